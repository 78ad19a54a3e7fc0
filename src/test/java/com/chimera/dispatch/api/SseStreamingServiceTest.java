package com.chimera.dispatch.api;

import com.chimera.core.events.ChimeraEvent;
import com.chimera.core.events.EventBus;
import com.chimera.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        service = new SseStreamingService(eventBus);
    }

    private static ChimeraEvent event(String type, String operationId) {
        return new ChimeraEvent(type, operationId, "link-1", Map.of("ability", "whoami"), Instant.now());
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitter {

        @Test
        @DisplayName("creates a distinct emitter per client")
        void distinctEmitters() {
            SseEmitter first = service.createEmitter("op-1");
            SseEmitter second = service.createEmitter("op-1");

            assertNotNull(first);
            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("starts with no active emitters")
        void startsEmpty() {
            assertEquals(0, service.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("event forwarding")
    class Forwarding {

        @Test
        @DisplayName("publishing events for the subscribed operation keeps the emitter registered")
        void forwardsEvents() {
            service.createEmitter("op-1");

            eventBus.publish(event("link.dispatched", "op-1"));
            eventBus.publish(event("link.success", "op-1"));

            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("events for other operations do not disturb subscribers")
        void noCrossDelivery() {
            service.createEmitter("op-1");
            service.createEmitter("op-2");

            eventBus.publish(event("link.dispatched", "op-1"));

            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("concurrent publishing does not throw")
        void concurrentPublish() throws InterruptedException {
            service.createEmitter("op-1");

            int threads = 5;
            CountDownLatch latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(event("fact.added." + threadId + "." + i, "op-1"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("a short timeout does not leave more registrations than emitters")
    void shortTimeout() throws InterruptedException {
        SseStreamingService shortLived = new SseStreamingService(eventBus, 100L);
        shortLived.createEmitter("op-1");

        Thread.sleep(300);

        assertTrue(shortLived.activeEmitterCount() <= 1);
    }
}

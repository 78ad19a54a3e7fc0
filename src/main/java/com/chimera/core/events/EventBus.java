package com.chimera.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for operation events.
 * <p>
 * Supports per-operation subscriptions and global subscriptions. A failing
 * subscriber is logged and skipped; it never reaches the publisher, so the
 * engine's locked sections cannot be broken by a slow or faulty consumer.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Clock clock;

    /** Per-operation subscribers keyed by operationId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ChimeraEvent>>> operationSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ChimeraEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public EventBus(Clock clock) {
        this.clock = clock;
    }

    public void publish(String eventType, String operationId, String linkId, Map<String, Object> payload) {
        publish(new ChimeraEvent(eventType, operationId, linkId, payload, clock.instant()));
    }

    public void publish(ChimeraEvent event) {
        log.debug("Publishing event: {} for operation {}", event.eventType(), event.operationId());

        if (event.operationId() != null) {
            List<Consumer<ChimeraEvent>> subs = operationSubscribers.get(event.operationId());
            if (subs != null) {
                for (Consumer<ChimeraEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }
        for (Consumer<ChimeraEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one operation.
     *
     * @return a handle that removes the subscription
     */
    public Subscription subscribe(String operationId, Consumer<ChimeraEvent> consumer) {
        operationSubscribers.computeIfAbsent(operationId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ChimeraEvent>> subs = operationSubscribers.get(operationId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /** Subscribe to events of every operation, plus agent-level events. */
    public Subscription subscribeAll(Consumer<ChimeraEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ChimeraEvent> subscriber, ChimeraEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}

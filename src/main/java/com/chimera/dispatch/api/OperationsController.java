package com.chimera.dispatch.api;

import com.chimera.core.engine.OperationService;
import com.chimera.core.engine.OperationStatusView;
import com.chimera.core.model.OperationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * REST controller for operation lifecycle.
 */
@RestController
@RequestMapping("/api/v1/operations")
public class OperationsController {

    private static final Logger log = LoggerFactory.getLogger(OperationsController.class);

    private final OperationService operationService;
    private final SseStreamingService sseStreamingService;

    public OperationsController(OperationService operationService, SseStreamingService sseStreamingService) {
        this.operationService = operationService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/operations: start an operation.
     */
    @PostMapping
    public ResponseEntity<OperationResponse> start(@RequestBody OperationRequest request) {
        if (request.adversary() == null || request.adversary().isBlank()) {
            throw new IllegalArgumentException("adversary is required");
        }
        OperationStatusView view = operationService.start(request.name(), request.adversary(),
                request.group(), request.facts());
        log.info("Operation {} started from API", view.id());
        return ResponseEntity.status(201).body(OperationResponse.from(view));
    }

    @GetMapping
    public List<OperationResponse> list() {
        return operationService.list().stream().map(OperationResponse::from).toList();
    }

    /**
     * GET /api/v1/operations/history: journaled operations, newest first, including earlier runs.
     */
    @GetMapping("/history")
    public List<OperationRecord> history() {
        return operationService.history();
    }

    @GetMapping("/{id}")
    public OperationResponse get(@PathVariable String id) {
        return OperationResponse.from(operationService.view(id));
    }

    @GetMapping("/{id}/facts")
    public List<FactResponse> facts(@PathVariable String id) {
        return operationService.get(id).facts().stream().map(FactResponse::from).toList();
    }

    /**
     * GET /api/v1/operations/{id}/links: every link generation, in creation order.
     */
    @GetMapping("/{id}/links")
    public List<LinkResponse> links(@PathVariable String id) {
        return operationService.get(id).links().stream().map(LinkResponse::from).toList();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        operationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/cancel")
    public OperationResponse cancel(@PathVariable String id) {
        log.info("Cancelling operation {}", id);
        return OperationResponse.from(operationService.get(id).cancel());
    }

    @PostMapping("/{id}/pause")
    public OperationResponse pause(@PathVariable String id) {
        return OperationResponse.from(operationService.get(id).pause());
    }

    @PostMapping("/{id}/resume")
    public OperationResponse resume(@PathVariable String id) {
        return OperationResponse.from(operationService.get(id).resume());
    }

    /**
     * PUT /api/v1/operations/{id}/abilities: replace the running profile's ability list.
     */
    @PutMapping("/{id}/abilities")
    public OperationResponse updateAbilities(@PathVariable String id, @RequestBody AbilitiesRequest request) {
        if (request.abilities() == null) {
            throw new IllegalArgumentException("abilities is required");
        }
        return OperationResponse.from(operationService.get(id).updateProfile(request.abilities()));
    }

    /**
     * GET /api/v1/operations/{id}/events: SSE stream of operation events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id) {
        if (!operationService.exists(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }
}

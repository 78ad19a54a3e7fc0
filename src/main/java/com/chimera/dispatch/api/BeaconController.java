package com.chimera.dispatch.api;

import com.chimera.core.dispatch.BeaconHandler;
import com.chimera.core.dispatch.BeaconRequest;
import com.chimera.core.dispatch.BeaconResponse;
import com.chimera.core.dispatch.ResultReport;
import com.chimera.core.link.ReportOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent-facing pull protocol.
 */
@RestController
@RequestMapping("/beacon")
public class BeaconController {

    private final BeaconHandler beaconHandler;

    public BeaconController(BeaconHandler beaconHandler) {
        this.beaconHandler = beaconHandler;
    }

    /**
     * POST /beacon: register or refresh an agent and collect its instructions.
     * No work is an empty instruction list, never an error.
     */
    @PostMapping
    public ResponseEntity<BeaconResponse> beacon(@RequestBody BeaconRequest request) {
        return ResponseEntity.ok(beaconHandler.beacon(request));
    }

    /**
     * POST /beacon/results: submit a link's output.
     * 200 for ACCEPTED and DUPLICATE, 404 for an unknown link, 409 for other rejections.
     */
    @PostMapping("/results")
    public ResponseEntity<Map<String, String>> results(@RequestBody ResultReport report) {
        ReportOutcome outcome = beaconHandler.report(report);
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", outcome.status().name());
        if (!outcome.isRejected()) {
            return ResponseEntity.ok(body);
        }
        body.put("reason", outcome.reason().name());
        HttpStatus status = outcome.reason() == ReportOutcome.RejectReason.UNKNOWN_LINK
                ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(body);
    }
}

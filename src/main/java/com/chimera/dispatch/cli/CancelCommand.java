package com.chimera.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: chimera cancel &lt;operation-id&gt;
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel an operation")
@Component
public class CancelCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Operation ID")
    private String operationId;

    private final ApiClient api;

    public CancelCommand(ApiClient api) {
        this.api = api;
    }

    @Override
    public Integer call() {
        try {
            JsonNode op = api.post("/api/v1/operations/" + operationId + "/cancel", null);
            ConsoleOutput.success("Operation " + operationId + " " + op.path("status").asText()
                    + " (" + op.path("links").path("DISCARDED").asInt() + " link(s) discarded)");
            return 0;
        } catch (ApiException e) {
            ConsoleOutput.error(e.getStatusCode() == 404 ? "Operation not found: " + operationId : e.getMessage());
            return 1;
        }
    }
}

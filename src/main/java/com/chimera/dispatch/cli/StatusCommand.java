package com.chimera.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.concurrent.Callable;

/**
 * CLI command: chimera status &lt;operation-id&gt;
 * <p>
 * Shows link counts, per-agent progress and BLOCKED pairs. With
 * {@code --watch}, follows the operation's SSE event stream instead.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show operation status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Operation ID")
    private String operationId;

    @Option(names = {"--watch", "-w"}, description = "Follow live events")
    private boolean watch;

    private final ApiClient api;

    public StatusCommand(ApiClient api) {
        this.api = api;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            if (watch) {
                ConsoleOutput.info("Watching operation " + operationId + " at " + api.baseUrl() + "...");
                api.stream("/api/v1/operations/" + operationId + "/events", ConsoleOutput::watchEvent);
                ConsoleOutput.info("Stream ended.");
                return 0;
            }
            print(api.get("/api/v1/operations/" + operationId));
            return 0;
        } catch (ApiException e) {
            ConsoleOutput.error(e.getStatusCode() == 404 ? "Operation not found: " + operationId : e.getMessage());
            return 1;
        }
    }

    private void print(JsonNode op) {
        System.out.println();
        System.out.println("OPERATION " + op.path("operation_id").asText() + "  " + op.path("name").asText());
        System.out.println("Adversary: " + op.path("adversary").asText()
                + " | Group: " + (op.path("group").isNull() ? "*" : op.path("group").asText()));
        System.out.println("Status: " + ConsoleOutput.status(op.path("status").asText()));
        if (op.hasNonNull("error")) {
            ConsoleOutput.error("Error: " + op.path("error").asText());
        }

        var counts = new ArrayList<String>();
        op.path("links").fields().forEachRemaining(e -> counts.add(e.getKey() + "=" + e.getValue().asInt()));
        ConsoleOutput.info("Links: " + String.join(", ", counts));
        ConsoleOutput.info("Facts: " + op.path("fact_count").asInt() + " | Frontier: " + op.path("frontier").asInt());

        JsonNode agents = op.path("agents");
        if (agents.size() > 0) {
            System.out.println();
            System.out.printf("  %-38s %-8s %-8s %6s %6s %6s %6s%n",
                    "AGENT", "PLATFORM", "STATUS", "QUEUED", "SENT", "OK", "FAILED");
            System.out.println("  " + "-".repeat(84));
            for (JsonNode a : agents) {
                System.out.printf("  %-38s %-8s %-8s %6d %6d %6d %6d%n",
                        a.path("paw").asText(), a.path("platform").asText("-"), a.path("status").asText(),
                        a.path("queued").asInt(), a.path("dispatched").asInt(),
                        a.path("succeeded").asInt(), a.path("failed").asInt());
            }
        }

        JsonNode blocked = op.path("blocked");
        if (blocked.size() > 0) {
            System.out.println();
            ConsoleOutput.warn("BLOCKED (" + blocked.size() + "):");
            for (JsonNode b : blocked) {
                String cause = b.hasNonNull("waiting_phase")
                        ? "waiting for phase " + b.path("waiting_phase").asText()
                        : "missing " + b.path("missing_facts");
                System.out.println("  " + b.path("ability").asText() + " on "
                        + ConsoleOutput.truncate(b.path("paw").asText(), 12) + ": " + cause);
            }
        }
    }
}

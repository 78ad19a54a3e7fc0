package com.chimera.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: chimera agents
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List known agents")
@Component
public class AgentsCommand implements Callable<Integer> {

    private final ApiClient api;

    public AgentsCommand(ApiClient api) {
        this.api = api;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            JsonNode agents = api.get("/api/v1/agents");
            if (agents.size() == 0) {
                ConsoleOutput.info("No agents have beaconed yet.");
                return 0;
            }
            System.out.printf("  %-38s %-8s %-20s %-10s %-8s %s%n",
                    "PAW", "PLATFORM", "HOST", "GROUP", "STATUS", "LAST SEEN");
            System.out.println("  " + "-".repeat(110));
            for (JsonNode a : agents) {
                System.out.printf("  %-38s %-8s %-20s %-10s %-8s %s%n",
                        a.path("paw").asText(), a.path("platform").asText("-"),
                        ConsoleOutput.truncate(a.path("hostname").asText(null), 20),
                        a.path("group").isNull() ? "-" : a.path("group").asText(),
                        a.path("status").asText(), a.path("lastSeen").asText());
            }
            return 0;
        } catch (ApiException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}

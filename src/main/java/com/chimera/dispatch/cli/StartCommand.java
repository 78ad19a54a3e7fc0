package com.chimera.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: chimera start &lt;adversary&gt; [-f key=value]...
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start an operation")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Adversary profile id")
    private String adversary;

    @Option(names = {"--name", "-n"}, description = "Operation name")
    private String name;

    @Option(names = {"--group", "-g"}, description = "Agent group to recruit (default: every agent)")
    private String group;

    @Option(names = {"--fact", "-f"}, description = "Seed fact as key=value; repeatable")
    private Map<String, String> facts = new LinkedHashMap<>();

    private final ApiClient api;

    public StartCommand(ApiClient api) {
        this.api = api;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var body = new LinkedHashMap<String, Object>();
        body.put("name", name);
        body.put("adversary", adversary);
        body.put("group", group);
        body.put("facts", facts);
        try {
            JsonNode op = api.post("/api/v1/operations", body);
            ConsoleOutput.success("Operation started: " + op.path("operation_id").asText());
            ConsoleOutput.info("Adversary: " + op.path("adversary").asText()
                    + " | Status: " + op.path("status").asText()
                    + " | Agents: " + op.path("agents").size()
                    + " | Seed facts: " + op.path("fact_count").asInt());
            return 0;
        } catch (ApiException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}

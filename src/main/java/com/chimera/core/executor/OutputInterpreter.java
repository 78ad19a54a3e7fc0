package com.chimera.core.executor;

import com.chimera.core.model.Ability;
import com.chimera.core.model.OutputRule;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Applies an ability's output rules to a raw result: normalizes the output
 * through the ability's executor, then runs every rule's parser. Duplicate
 * (key, value) pairs within one result are collapsed.
 */
@Component
public class OutputInterpreter {

    private static final Logger log = LoggerFactory.getLogger(OutputInterpreter.class);

    private final ExecutorRegistry executors;
    private final Map<String, OutputParser> parsers = new HashMap<>();

    public OutputInterpreter(ExecutorRegistry executors, ObjectMapper objectMapper) {
        this.executors = executors;
        for (OutputParser parser : List.of(new LineOutputParser(), new RegexOutputParser(),
                new KeyValueOutputParser(), new JsonOutputParser(objectMapper))) {
            parsers.put(parser.name(), parser);
        }
    }

    public boolean supportsParser(String name) {
        return name != null && parsers.containsKey(name);
    }

    public List<ParsedFact> interpret(Ability ability, String rawOutput) {
        if (ability.outputRules().isEmpty()) return List.of();
        String output = executors.forKind(ability.executor()).normalize(rawOutput);
        var facts = new LinkedHashSet<ParsedFact>();
        for (OutputRule rule : ability.outputRules()) {
            OutputParser parser = parsers.get(rule.parser());
            if (parser == null) {
                log.warn("Ability {} references unknown parser '{}', rule skipped", ability.id(), rule.parser());
                continue;
            }
            try {
                facts.addAll(parser.parse(output, rule));
            } catch (RuntimeException e) {
                log.warn("Ability {} rule {}:{} failed, rule skipped: {}",
                        ability.id(), rule.parser(), rule.factKey(), e.getMessage());
            }
        }
        return new ArrayList<>(facts);
    }
}

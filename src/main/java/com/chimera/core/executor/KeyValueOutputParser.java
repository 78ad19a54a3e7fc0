package com.chimera.core.executor;

import com.chimera.core.model.OutputRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code key=value} lines. With fact key "*" every key is kept,
 * otherwise only lines for the rule's key.
 */
public class KeyValueOutputParser implements OutputParser {

    static final String ANY_KEY = "*";

    @Override
    public String name() {
        return "key_value";
    }

    @Override
    public List<ParsedFact> parse(String output, OutputRule rule) {
        var facts = new ArrayList<ParsedFact>();
        for (String line : output.lines().toList()) {
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).strip();
            String value = line.substring(eq + 1).strip();
            if (key.isEmpty() || value.isEmpty()) continue;
            if (ANY_KEY.equals(rule.factKey()) || rule.factKey().equals(key)) {
                facts.add(new ParsedFact(key, value));
            }
        }
        return facts;
    }
}

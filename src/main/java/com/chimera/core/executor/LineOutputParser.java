package com.chimera.core.executor;

import com.chimera.core.model.OutputRule;

import java.util.List;

/**
 * Every non-blank output line becomes a value of the rule's key.
 */
public class LineOutputParser implements OutputParser {

    @Override
    public String name() {
        return "line";
    }

    @Override
    public List<ParsedFact> parse(String output, OutputRule rule) {
        return output.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .map(line -> new ParsedFact(rule.factKey(), line))
                .toList();
    }
}

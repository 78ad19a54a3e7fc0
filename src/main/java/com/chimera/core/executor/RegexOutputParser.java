package com.chimera.core.executor;

import com.chimera.core.model.OutputRule;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Each match of the rule's pattern yields a value: capture group 1 when the
 * pattern has one, the whole match otherwise.
 */
public class RegexOutputParser implements OutputParser {

    @Override
    public String name() {
        return "regex";
    }

    @Override
    public List<ParsedFact> parse(String output, OutputRule rule) {
        if (rule.pattern() == null || rule.pattern().isEmpty()) {
            throw new IllegalArgumentException("regex rule for " + rule.factKey() + " has no pattern");
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(rule.pattern(), Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex for " + rule.factKey() + ": " + e.getMessage(), e);
        }
        var facts = new ArrayList<ParsedFact>();
        Matcher m = pattern.matcher(output);
        while (m.find()) {
            String value = m.groupCount() >= 1 ? m.group(1) : m.group();
            if (value != null && !value.isBlank()) {
                facts.add(new ParsedFact(rule.factKey(), value.strip()));
            }
        }
        return facts;
    }
}

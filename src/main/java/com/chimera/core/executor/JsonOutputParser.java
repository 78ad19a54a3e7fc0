package com.chimera.core.executor;

import com.chimera.core.model.OutputRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses output as JSON and collects the scalar values found at the rule's
 * dotted path. Arrays along the path fan out. Output that is not JSON yields no facts.
 */
public class JsonOutputParser implements OutputParser {

    private static final Logger log = LoggerFactory.getLogger(JsonOutputParser.class);

    private final ObjectMapper objectMapper;

    public JsonOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public List<ParsedFact> parse(String output, OutputRule rule) {
        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            log.debug("Output is not JSON, no facts for {}: {}", rule.factKey(), e.getOriginalMessage());
            return List.of();
        }
        if (root == null) return List.of();

        String path = rule.pattern() == null ? "" : rule.pattern();
        var nodes = new ArrayList<JsonNode>();
        collect(root, path.isEmpty() ? new String[0] : path.split("\\."), 0, nodes);

        var facts = new ArrayList<ParsedFact>();
        for (JsonNode node : nodes) {
            if (node.isValueNode() && !node.isNull()) {
                facts.add(new ParsedFact(rule.factKey(), node.asText()));
            }
        }
        return facts;
    }

    private void collect(JsonNode node, String[] segments, int index, List<JsonNode> out) {
        if (node == null || node.isMissingNode()) return;
        if (node.isArray()) {
            for (JsonNode element : node) {
                collect(element, segments, index, out);
            }
            return;
        }
        if (index == segments.length) {
            out.add(node);
            return;
        }
        collect(node.get(segments[index]), segments, index + 1, out);
    }
}

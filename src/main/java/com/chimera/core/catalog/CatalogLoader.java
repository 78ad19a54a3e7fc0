package com.chimera.core.catalog;

import com.chimera.core.executor.ExecutorRegistry;
import com.chimera.core.executor.OutputInterpreter;
import com.chimera.core.model.Ability;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.OutputRule;
import com.chimera.core.model.RetryPolicy;
import com.chimera.core.model.TacticPhase;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Loads ability and adversary definitions from a directory:
 * <pre>
 *   &lt;root&gt;/abilities/*.json    one ability object or an array of them
 *   &lt;root&gt;/adversaries/*.json  one adversary object or an array of them
 * </pre>
 * Files are read in name order so catalog order is reproducible.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper objectMapper;
    private final ExecutorRegistry executors;
    private final OutputInterpreter interpreter;

    public CatalogLoader(ObjectMapper objectMapper, ExecutorRegistry executors, OutputInterpreter interpreter) {
        this.objectMapper = objectMapper;
        this.executors = executors;
        this.interpreter = interpreter;
    }

    public AbilityCatalog load(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            log.warn("Catalog directory {} not found; starting with an empty catalog", root);
            return AbilityCatalog.empty(executors);
        }
        var abilities = new ArrayList<Ability>();
        for (AbilityDefinition def : readAll(root.resolve("abilities"), AbilityDefinition.class)) {
            abilities.add(toAbility(def));
        }
        var profiles = new ArrayList<AdversaryProfile>();
        for (AdversaryDefinition def : readAll(root.resolve("adversaries"), AdversaryDefinition.class)) {
            profiles.add(toProfile(def));
        }
        var catalog = new AbilityCatalog(abilities, profiles, executors);
        log.info("Loaded catalog from {}: {} abilities, {} adversaries",
                root, abilities.size(), profiles.size());
        return catalog;
    }

    private <T> List<T> readAll(Path dir, Class<T> type) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            throw new CatalogException("Cannot list " + dir, e);
        }
        var result = new ArrayList<T>();
        for (Path file : files) {
            try {
                JsonNode node = objectMapper.readTree(file.toFile());
                if (node.isArray()) {
                    for (JsonNode element : node) {
                        result.add(objectMapper.treeToValue(element, type));
                    }
                } else {
                    result.add(objectMapper.treeToValue(node, type));
                }
            } catch (IOException e) {
                throw new CatalogException("Cannot parse " + file + ": " + e.getMessage(), e);
            }
        }
        return result;
    }

    Ability toAbility(AbilityDefinition def) {
        if (def.id() == null || def.id().isBlank()) {
            throw new CatalogException("Ability without id");
        }
        if (def.command() == null) {
            throw new CatalogException("Ability " + def.id() + " has no command");
        }
        var rules = new ArrayList<OutputRule>();
        if (def.parsers() != null) {
            for (ParserDefinition p : def.parsers()) {
                rules.add(toRule(def.id(), p));
            }
        }
        List<String> platforms = def.platforms() == null ? List.of()
                : def.platforms().stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
        int attempts = def.maxAttempts() == null ? 1 : def.maxAttempts();
        if (attempts < 1) {
            throw new CatalogException("Ability " + def.id() + " has max_attempts < 1");
        }
        Duration timeout = def.timeoutSeconds() == null ? null : Duration.ofSeconds(def.timeoutSeconds());
        String executor = def.executor() == null ? "sh" : def.executor().toLowerCase(Locale.ROOT);
        if (!executors.isKnown(executor)) {
            log.debug("Ability {} uses executor '{}' with no dedicated handler; output passes through",
                    def.id(), executor);
        }
        return new Ability(def.id(), def.name() == null ? def.id() : def.name(), def.tactic(),
                def.description(), new LinkedHashSet<>(platforms), executor, def.command(),
                def.requires() == null ? null : new LinkedHashSet<>(def.requires()),
                rules, new RetryPolicy(attempts), timeout);
    }

    private OutputRule toRule(String abilityId, ParserDefinition p) {
        if (!interpreter.supportsParser(p.parser())) {
            throw new CatalogException("Ability " + abilityId + " uses unknown parser '" + p.parser() + "'");
        }
        if (p.fact() == null || p.fact().isBlank()) {
            throw new CatalogException("Ability " + abilityId + " has a parser without a fact key");
        }
        if ("regex".equals(p.parser())) {
            if (p.pattern() == null || p.pattern().isEmpty()) {
                throw new CatalogException("Ability " + abilityId + " has a regex parser without a pattern");
            }
            try {
                Pattern.compile(p.pattern());
            } catch (PatternSyntaxException e) {
                throw new CatalogException("Ability " + abilityId + " has an invalid pattern: " + e.getMessage(), e);
            }
        }
        return new OutputRule(p.parser(), p.fact(), p.pattern());
    }

    private AdversaryProfile toProfile(AdversaryDefinition def) {
        if (def.id() == null || def.id().isBlank()) {
            throw new CatalogException("Adversary without id");
        }
        var phases = new ArrayList<TacticPhase>();
        if (def.phases() != null) {
            for (PhaseDefinition p : def.phases()) {
                phases.add(new TacticPhase(p.name(), p.optional() != null && p.optional()));
            }
        }
        return new AdversaryProfile(def.id(), def.name() == null ? def.id() : def.name(),
                def.abilities(), phases);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AbilityDefinition(
        String id,
        String name,
        String tactic,
        String description,
        List<String> platforms,
        String executor,
        String command,
        List<String> requires,
        List<ParserDefinition> parsers,
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("timeout_seconds") Long timeoutSeconds
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ParserDefinition(String parser, String fact, String pattern) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AdversaryDefinition(String id, String name, List<String> abilities, List<PhaseDefinition> phases) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PhaseDefinition(String name, Boolean optional) {}
}

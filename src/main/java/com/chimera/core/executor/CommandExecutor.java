package com.chimera.core.executor;

import java.util.Map;
import java.util.Set;

/**
 * Capability of one executor kind: how its command templates are rendered and
 * how the output it produces is normalized before fact parsing.
 * <p>
 * The set of implementations is closed and selected by executor tag through
 * {@link ExecutorRegistry}.
 */
public interface CommandExecutor {

    /** Executor tags this implementation handles. */
    Set<String> kinds();

    /**
     * Renders a command template against resolved fact values.
     *
     * @throws MissingFactException if a placeholder has no value
     */
    default String render(String template, Map<String, String> facts) {
        return Placeholders.substitute(template, facts);
    }

    /** Normalizes raw agent output before parsing. */
    String normalize(String output);
}

package com.chimera.core.executor;

import java.util.Set;

/**
 * Fallback for executor tags without a dedicated implementation. Output is passed through.
 */
public class GenericExecutor implements CommandExecutor {

    @Override
    public Set<String> kinds() {
        return Set.of();
    }

    @Override
    public String normalize(String output) {
        return output == null ? "" : output;
    }
}

package com.chimera.core.executor;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps executor tags to their {@link CommandExecutor}. Unknown tags fall back
 * to {@link GenericExecutor}.
 */
@Component
public class ExecutorRegistry {

    private final Map<String, CommandExecutor> byKind = new HashMap<>();
    private final CommandExecutor fallback = new GenericExecutor();

    public ExecutorRegistry() {
        this(List.of(new ShellExecutor(), new WindowsExecutor()));
    }

    ExecutorRegistry(List<CommandExecutor> executors) {
        for (CommandExecutor executor : executors) {
            for (String kind : executor.kinds()) {
                byKind.put(kind, executor);
            }
        }
    }

    public CommandExecutor forKind(String kind) {
        if (kind == null) return fallback;
        return byKind.getOrDefault(kind.toLowerCase(), fallback);
    }

    public boolean isKnown(String kind) {
        return kind != null && byKind.containsKey(kind.toLowerCase());
    }
}

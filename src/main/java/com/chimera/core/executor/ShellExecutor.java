package com.chimera.core.executor;

import java.util.Set;

/**
 * POSIX shells. Output keeps its content; only carriage returns and the
 * trailing newline are dropped.
 */
public class ShellExecutor implements CommandExecutor {

    @Override
    public Set<String> kinds() {
        return Set.of("sh", "bash", "zsh");
    }

    @Override
    public String normalize(String output) {
        if (output == null) return "";
        String text = output.replace("\r\n", "\n");
        while (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }
}

package com.chimera.core.executor;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * PowerShell and cmd. Console output pads lines with trailing spaces and uses
 * CRLF, so every line is right-trimmed.
 */
public class WindowsExecutor implements CommandExecutor {

    @Override
    public Set<String> kinds() {
        return Set.of("psh", "pwsh", "cmd");
    }

    @Override
    public String normalize(String output) {
        if (output == null) return "";
        return output.replace("\r\n", "\n").lines()
                .map(String::stripTrailing)
                .collect(Collectors.joining("\n"))
                .strip();
    }
}

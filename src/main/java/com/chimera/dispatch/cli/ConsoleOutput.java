package com.chimera.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Chimera CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) CHIMERA v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHIMERA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    /** Colors an operation or link status name. */
    public static String status(String status) {
        String color = switch (status) {
            case "FINISHED", "SUCCESS", "ACTIVE" -> "fg(green)";
            case "RUNNING", "DISPATCHED", "QUEUED" -> "fg(cyan)";
            case "PAUSED", "STALE", "TIMEOUT", "DISCARDED" -> "fg(yellow)";
            case "CANCELLED" -> "fg(white)";
            default -> "fg(red)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status + "|@");
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "operation.started", "operation.status", "operation.profile" -> "@|fg(cyan) [OPERATION]|@";
            case "agent.joined" -> "@|fg(blue) [AGENT]|@";
            case "agent.dead" -> "@|fg(red) [AGENT]|@";
            case "link.queued", "link.dispatched" -> "@|fg(blue) [LINK]|@";
            case "link.completed" -> "@|bold,fg(blue) [LINK]|@";
            case "fact.committed" -> "@|fg(green) [FACT]|@";
            case "report.rejected" -> "@|fg(yellow) [REJECTED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}

package com.gridcast.dispatch.cli;

import com.gridcast.core.model.ForecastPoint;
import com.gridcast.core.model.ForecastResult;
import picocli.CommandLine;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * ANSI-colored terminal output utilities for the Gridcast CLI.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter HOUR_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GRIDCAST v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GRIDCAST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void forecast(ForecastResult result) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Forecast|@ " + result.target() + " (" + result.kind() + ", candidate "
                        + result.candidateId() + ", " + result.horizon() + " steps)"));
        System.out.printf("  %-18s %12s %12s %12s%n", "HOUR (UTC)", "LOWER", "ESTIMATE", "UPPER");
        System.out.println("  " + "-".repeat(57));
        for (ForecastPoint point : result.points()) {
            System.out.printf("  %-18s %12.1f %12.1f %12.1f%n",
                    HOUR_FORMAT.format(point.timestamp()), point.lower(), point.estimate(), point.upper());
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "session.created" -> "@|fg(cyan) [SESSION]|@";
            case "phase.completed" -> "@|fg(blue) [PHASE]|@";
            case "capability.completed" -> "@|fg(magenta) [CAPABILITY]|@";
            case "session.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "session.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}

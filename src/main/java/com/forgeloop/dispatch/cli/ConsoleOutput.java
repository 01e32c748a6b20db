package com.forgeloop.dispatch.cli;

import com.forgeloop.core.build.BuildOutcome;
import com.forgeloop.core.events.LifecycleEvent;
import com.forgeloop.core.model.TerminalEntry;
import picocli.CommandLine;

import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Forgeloop CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FORGELOOP v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FORGELOOP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void terminal(TerminalEntry entry) {
        String color = switch (entry.level()) {
            case INFO -> "fg(white)";
            case SUCCESS -> "fg(green)";
            case WARNING -> "fg(yellow)";
            case ERROR -> "fg(red)";
        };
        String agent = entry.agent() != null ? entry.agent().displayName() : "System";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + agent + "]|@ @|" + color + " " + entry.message() + "|@"));
    }

    public static void event(LifecycleEvent event) {
        String type = event.type().wireName();
        String prefix = switch (event.type()) {
            case BUILD_STARTED, PROJECT_CREATED, PLAN_GENERATED, IDEATION_COMPLETED -> "@|fg(cyan) [" + type + "]|@";
            case CODE_GENERATED, CODE_UPDATED, PROJECT_UPDATED -> "@|fg(blue) [" + type + "]|@";
            case TEST_PASSED, BUILD_COMPLETED -> "@|fg(green) [" + type + "]|@";
            case TEST_FAILED, BUILD_FAILED, ERROR_OCCURRED -> "@|fg(red) [" + type + "]|@";
            default -> "@|fg(white) [" + type + "]|@";
        };
        String data = event.payload().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void outcome(BuildOutcome outcome) {
        System.out.println("──────────────────────────────────");
        switch (outcome.status()) {
            case COMPLETED -> success("Build completed");
            case HALTED -> error("Build halted at " + outcome.failedPath() + " (" + outcome.failureKind() + "): "
                    + outcome.message());
            case CANCELLED -> error("Build cancelled");
            case REJECTED -> error(outcome.message());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Files generated: " + outcome.filesGenerated() + ", debug attempts: " + outcome.debugAttempts()));
    }
}

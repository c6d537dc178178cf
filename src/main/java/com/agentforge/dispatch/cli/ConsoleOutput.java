package com.agentforge.dispatch.cli;

import com.agentforge.core.events.OrchestrationEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Agentforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints one run event, colored by kind.
     */
    public static void event(OrchestrationEvent event) {
        String prefix = String.format("%3d ", event.sequenceNumber());
        String source = event.sourceAgent() != null ? " @|faint (" + event.sourceAgent() + ")|@" : "";
        String label = switch (event.kind()) {
            case PROGRESS -> "@|fg(cyan) PROGRESS|@";
            case PARTIAL -> "@|fg(blue) PARTIAL |@";
            case WARNING -> "@|fg(yellow) WARNING |@";
            case ERROR -> "@|fg(red),bold ERROR   |@";
            case FINAL -> "@|fg(green),bold FINAL   |@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + label + source + " ")
                + event.payload());
    }
}

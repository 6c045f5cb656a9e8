package com.qmb.dispatch.cli;

import com.qmb.core.model.AnalysisWarning;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the qmb CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) QLIK MODEL BUILDER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [QMB]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(String label, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [STAGE " + label + "]|@ " + message));
    }

    public static void warning(AnalysisWarning warning) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [" + warning.type() + "]|@ " + warning.message()));
    }

    public static void scope(boolean allowed, String detail) {
        if (allowed) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green),bold [ALLOWED]|@ " + detail));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red),bold [BLOCKED]|@ " + detail));
        }
    }
}

package com.hivemind.dispatch.cli;

import com.hivemind.core.model.AlignmentObservation;
import com.hivemind.core.model.NodeStatus;
import com.hivemind.core.progress.NodeProgress;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for Hivemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIVEMIND]|@ " + message));
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

    public static void agent(String level, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + level + "]|@ " + message));
    }

    /**
     * Prints a node and its subtree, one line per node, indented by depth.
     */
    public static void tree(NodeProgress node, int depth) {
        String indent = "  ".repeat(depth);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + statusMarker(node.status()) + " " + node.ref() + " "
                        + progressBar(node.percentage()) + " " + node.percentage() + "%  "
                        + (node.title() == null ? "" : node.title())));
        for (NodeProgress child : node.children()) {
            tree(child, depth + 1);
        }
    }

    public static void observation(String visionId, AlignmentObservation o) {
        String score = String.format(Locale.ROOT, "%.3f", o.score());
        String colored = o.driftDetected() ? "@|fg(red) " + score + "|@" : "@|fg(green) " + score + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold VISION " + visionId + "|@ alignment " + colored + " (" + o.severity() + ", "
                        + o.completionPercentage() + "% complete)"));
        System.out.println(String.format(Locale.ROOT, "  timeline %.2f | scope %.2f | quality %.2f",
                o.factors().timeline(), o.factors().scope(), o.factors().quality()));
        for (String issue : o.issues()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + issue));
        }
        o.adjustments().forEach(a -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    " + (a.critical() ? "@|fg(red),bold [" : "@|fg(yellow) [") + a.area().toUpperCase(Locale.ROOT)
                        + "]|@ " + a.recommendation())));
    }

    static String statusMarker(NodeStatus status) {
        return switch (status) {
            case COMPLETED -> "@|fg(green) ✔|@";
            case IN_PROGRESS -> "@|fg(cyan) ▶|@";
            case BLOCKED -> "@|fg(yellow) ■|@";
            case FAILED -> "@|fg(red) ✖|@";
            case PENDING -> "@|fg(white) ·|@";
        };
    }

    static String progressBar(int percentage) {
        int filled = Math.max(0, Math.min(10, percentage / 10));
        return "[" + "#".repeat(filled) + "-".repeat(10 - filled) + "]";
    }
}

package com.agentvm.dispatch.cli;

import com.agentvm.pool.PoolState;
import com.agentvm.pool.PoolStats;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the AgentVM CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTVM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTVM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void poolStats(PoolStats stats) {
        String stateColor = stats.state() == PoolState.READY ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold POOL " + stats.poolId() + "|@ @|" + stateColor + " " + stats.state() + "|@"));
        System.out.printf("  %-14s %d%n", "Available", stats.available());
        System.out.printf("  %-14s %d%n", "Checked out", stats.checkedOut());
        System.out.printf("  %-14s %d%n", "Creating", stats.creating());
        System.out.printf("  %-14s %d..%d%n", "Size bounds", stats.minSize(), stats.maxSize());
        System.out.printf("  %-14s %d (avg %.1fms)%n", "Acquisitions",
                stats.acquisitions(), stats.averageAcquisitionMillis());
        if (stats.state() == PoolState.READY && stats.available() < stats.minSize()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) below minimum, refill pending|@"));
        }
    }
}

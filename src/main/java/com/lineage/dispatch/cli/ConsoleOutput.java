package com.lineage.dispatch.cli;

import com.lineage.core.persistence.migration.MigrationResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the lineage CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LINEAGE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LINEAGE]|@ " + message));
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

    public static void migration(String target, MigrationResult result) {
        if (result.success()) {
            String detail = result.migratedCount() > 0
                    ? result.migratedCount() + " record" + (result.migratedCount() != 1 ? "s" : "") + " migrated"
                    : "nothing to migrate";
            success(target + ": " + detail + (result.backupCreated() ? " (backup kept)" : ""));
        } else {
            error(target + ": " + result.errorMessage()
                    + (result.backupCreated() ? " (backup available, run 'lineage restore " + target + "')" : ""));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}

package com.lineage.core.persistence;

import java.util.regex.Pattern;

/**
 * Physical table names derived from the configured prefix.
 */
public record TableNames(String prefix) {

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public TableNames {
        if (prefix == null || !SAFE_IDENTIFIER.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Table prefix must be a plain SQL identifier: " + prefix);
        }
    }

    public String conversations() { return prefix + "_conversations"; }
    public String messages() { return prefix + "_messages"; }
    public String history() { return prefix + "_agent_history"; }
    public String steps() { return prefix + "_agent_history_steps"; }
    public String events() { return prefix + "_agent_history_timeline_events"; }
    public String migrationFlags() { return prefix + "_conversations_migration_flags"; }

    public static String backupOf(String table) { return table + "_backup"; }
    public static String tempOf(String table) { return table + "_temp"; }
}

package com.lineage.dispatch.cli;

import com.lineage.core.persistence.DurableTimelineStore.MigrationTarget;

import java.util.List;
import java.util.Locale;

/**
 * Maps CLI target names to store migration targets.
 */
final class MigrationTargets {

    static final String CONVERSATIONS = "conversations";
    static final String HISTORY = "history";
    static final String ALL = "all";

    private MigrationTargets() {
    }

    static List<MigrationTarget> parse(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case CONVERSATIONS -> List.of(MigrationTarget.CONVERSATIONS);
            case HISTORY -> List.of(MigrationTarget.AGENT_HISTORY);
            case ALL -> List.of(MigrationTarget.CONVERSATIONS, MigrationTarget.AGENT_HISTORY);
            default -> throw new IllegalArgumentException(
                    "Unknown target '" + name + "' (expected conversations, history or all)");
        };
    }

    static String label(MigrationTarget target) {
        return target == MigrationTarget.CONVERSATIONS ? CONVERSATIONS : HISTORY;
    }
}

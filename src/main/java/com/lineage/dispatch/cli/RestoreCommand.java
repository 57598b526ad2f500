package com.lineage.dispatch.cli;

import com.lineage.core.persistence.DurableTimelineStore;
import com.lineage.core.persistence.DurableTimelineStore.MigrationTarget;
import com.lineage.core.persistence.migration.MigrationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lineage restore &lt;conversations|history&gt;
 * <p>
 * Puts the pre-migration backup back in place and clears the migration flag,
 * so the next startup or {@code lineage migrate} retries the migration.
 */
@Command(name = "restore", mixinStandardHelpOptions = true, description = "Restore tables from a migration backup")
@Component
public class RestoreCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "conversations or history")
    private String target;

    private final DurableTimelineStore store;

    public RestoreCommand(DurableTimelineStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<MigrationTarget> targets;
        try {
            targets = MigrationTargets.parse(target);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        if (targets.size() != 1) {
            ConsoleOutput.error("Restore one target at a time: conversations or history");
            return 2;
        }

        MigrationTarget t = targets.get(0);
        if (!store.hasBackup(t)) {
            ConsoleOutput.error("No backup found for " + MigrationTargets.label(t));
            return 1;
        }
        MigrationResult result = store.restoreFromBackup(t);
        if (!result.success()) {
            ConsoleOutput.error("Restore failed: " + result.errorMessage());
            return 1;
        }
        ConsoleOutput.success(MigrationTargets.label(t) + " restored from backup; migration will re-run");
        return 0;
    }
}

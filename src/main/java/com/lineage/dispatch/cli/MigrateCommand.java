package com.lineage.dispatch.cli;

import com.lineage.core.persistence.DurableTimelineStore;
import com.lineage.core.persistence.DurableTimelineStore.MigrationTarget;
import com.lineage.core.persistence.Timestamps;
import com.lineage.core.persistence.migration.MigrationFlag;
import com.lineage.core.persistence.migration.MigrationOptions;
import com.lineage.core.persistence.migration.MigrationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lineage migrate [conversations|history|all]
 * <p>
 * Runs pending schema migrations explicitly. Already-applied migrations are
 * reported as "nothing to migrate". Exit code is 1 when any migration fails.
 */
@Command(name = "migrate", mixinStandardHelpOptions = true, description = "Run pending storage migrations")
@Component
public class MigrateCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = MigrationTargets.ALL,
            description = "conversations, history or all (default: ${DEFAULT-VALUE})")
    private String target;

    @Option(names = "--no-backup", description = "Skip the backup snapshot")
    private boolean noBackup;

    @Option(names = "--delete-backup", description = "Drop the backup after a successful migration")
    private boolean deleteBackup;

    @Option(names = "--status", description = "Only list completed migrations")
    private boolean statusOnly;

    private final DurableTimelineStore store;

    public MigrateCommand(DurableTimelineStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (statusOnly) {
            printFlags(store.getMigrationFlags());
            return 0;
        }

        List<MigrationTarget> targets;
        try {
            targets = MigrationTargets.parse(target);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        var options = new MigrationOptions(!noBackup, deleteBackup);
        boolean failed = false;
        for (MigrationTarget t : targets) {
            MigrationResult result = store.migrate(t, options);
            ConsoleOutput.migration(MigrationTargets.label(t), result);
            failed |= !result.success();
        }
        return failed ? 1 : 0;
    }

    private static void printFlags(List<MigrationFlag> flags) {
        if (flags.isEmpty()) {
            ConsoleOutput.info("No migrations recorded.");
            return;
        }
        System.out.printf("  %-36s %-26s %s%n", "MIGRATION", "COMPLETED AT", "RECORDS");
        System.out.println("  " + "-".repeat(72));
        for (MigrationFlag flag : flags) {
            System.out.printf("  %-36s %-26s %d%n", flag.migrationType(),
                    flag.completedAt() == null ? "-" : Timestamps.format(flag.completedAt()),
                    flag.migratedCount());
        }
    }
}

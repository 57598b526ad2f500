package com.lineage.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 */
@Command(
        name = "lineage",
        mixinStandardHelpOptions = true,
        version = "Lineage 0.1.0",
        description = "Agent execution history: event propagation, real-time fan-out and durable timelines",
        subcommands = {
                ServeCommand.class,
                MigrateCommand.class,
                RestoreCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LineageCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}

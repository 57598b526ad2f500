package com.lineage.dispatch.cli;

import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.persistence.DurableTimelineStore;
import com.lineage.core.persistence.Timestamps;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: lineage history &lt;agentId&gt;
 * <p>
 * Lists an agent's execution entries, oldest first:
 * Entry ID | Status | Started | Events.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List an agent's execution history")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", description = "Agent id")
    private String agentId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final DurableTimelineStore store;

    public HistoryCommand(DurableTimelineStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ExecutionEntry> entries = store.getAllHistoryEntriesByAgent(agentId);
        if (entries.isEmpty()) {
            ConsoleOutput.info("No history for agent " + agentId + ".");
            return;
        }

        List<ExecutionEntry> display = entries.size() > limit
                ? entries.subList(entries.size() - limit, entries.size())
                : entries;

        ConsoleOutput.info("History of " + agentId + " (" + display.size() + " of " + entries.size() + "):");
        System.out.println();
        System.out.printf("  %-38s %-12s %-26s %s%n", "ENTRY ID", "STATUS", "STARTED", "EVENTS");
        System.out.println("  " + "-".repeat(86));

        for (ExecutionEntry entry : display) {
            System.out.printf("  %-38s %-12s %-26s %d%n",
                    ConsoleOutput.truncate(entry.id(), 38),
                    entry.status() == null ? "-" : entry.status().value(),
                    entry.startTime() == null ? "-" : Timestamps.format(entry.startTime()),
                    entry.events() == null ? 0 : entry.events().size());
        }
    }
}

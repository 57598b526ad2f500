package com.lineage.core.registry;

import com.lineage.core.model.ExecutionEntry;

import java.util.List;

/**
 * Minimal {@link Agent} whose history lives in a {@link HistoryManager}.
 */
public class TrackedAgent implements Agent {

    private final String id;
    private final String name;
    private final HistoryManager historyManager;

    public TrackedAgent(String id, String name, HistoryManager historyManager) {
        this.id = id;
        this.name = name;
        this.historyManager = historyManager;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<ExecutionEntry> getHistory() {
        return historyManager.getEntries();
    }

    @Override
    public HistoryManager getHistoryManager() {
        return historyManager;
    }

    @Override
    public String toString() {
        return "TrackedAgent[" + id + ", " + name + "]";
    }
}

package com.lineage.core.registry;

import com.lineage.core.model.ExecutionEntry;

import java.util.List;

/**
 * An agent whose runs are tracked. Implemented by the execution engine.
 */
public interface Agent {

    String getId();

    String getName();

    /**
     * The agent's execution entries, oldest first.
     */
    List<ExecutionEntry> getHistory();

    HistoryManager getHistoryManager();
}

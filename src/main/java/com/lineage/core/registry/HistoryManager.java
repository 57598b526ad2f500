package com.lineage.core.registry;

import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.HistoryStep;
import com.lineage.core.model.TimelineEvent;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence facade for one agent's execution history.
 */
public interface HistoryManager {

    /**
     * Starts a new running entry.
     */
    ExecutionEntry addEntry(Object input);

    /**
     * Changes an entry's status and output; a terminal status also sets the end time.
     */
    ExecutionEntry updateEntry(String historyId, AgentStatus status, Object output, Map<String, Object> usage);

    ExecutionEntry addStep(String historyId, HistoryStep step);

    /**
     * Appends {@code event} under {@code historyId} for this agent and returns
     * the entry as this agent sees it, or empty when no such entry exists.
     */
    Optional<ExecutionEntry> persistTimelineEvent(String historyId, TimelineEvent event);

    List<ExecutionEntry> getEntries();
}

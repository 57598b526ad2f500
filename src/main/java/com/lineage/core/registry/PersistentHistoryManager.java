package com.lineage.core.registry;

import com.lineage.core.events.EventHub;
import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.HistoryStep;
import com.lineage.core.model.TimelineEvent;
import com.lineage.core.persistence.DurableTimelineStore;
import com.lineage.core.persistence.RecordNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link HistoryManager} backed by the {@link DurableTimelineStore}.
 * <p>
 * Every write is announced on the {@link EventHub}. Creation is relayed to
 * ancestors immediately; status changes are relayed only when the entry
 * reaches a terminal status, since the start was already relayed on creation.
 * <p>
 * Updates carry a sequence number that increases strictly per agent and never
 * falls behind the clock's epoch millis.
 */
public class PersistentHistoryManager implements HistoryManager {

    private static final Logger log = LoggerFactory.getLogger(PersistentHistoryManager.class);

    private final String agentId;
    private final DurableTimelineStore store;
    private final EventHub eventHub;
    private final AgentRegistry registry;
    private final Clock clock;
    private final AtomicLong lastSequence = new AtomicLong();

    public PersistentHistoryManager(String agentId, DurableTimelineStore store, EventHub eventHub,
                                    AgentRegistry registry, Clock clock) {
        this.agentId = agentId;
        this.store = store;
        this.eventHub = eventHub;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public ExecutionEntry addEntry(Object input) {
        ExecutionEntry entry = ExecutionEntry.started(UUID.randomUUID().toString(), agentId, input, clock.instant());
        store.addHistoryEntry(entry);
        log.debug("Agent {} started entry {}", agentId, entry.id());
        eventHub.emitHistoryEntryCreated(agentId, entry);
        eventHub.emitHierarchicalHistoryEntryCreated(agentId, entry, registry);
        return entry;
    }

    @Override
    public ExecutionEntry updateEntry(String historyId, AgentStatus status, Object output, Map<String, Object> usage) {
        ExecutionEntry existing = store.getHistoryEntry(historyId)
                .orElseThrow(() -> new RecordNotFoundException("History entry", historyId));
        boolean becameTerminal = status != null && status.isTerminal()
                && (existing.status() == null || !existing.status().isTerminal());
        Instant endTime = status != null && status.isTerminal() ? clock.instant() : existing.endTime();

        ExecutionEntry changed = existing.withStatus(status != null ? status : existing.status(),
                output != null ? output : existing.output(), endTime);
        if (usage != null) {
            changed = changed.withUsage(usage);
        }
        store.updateHistoryEntry(changed);
        ExecutionEntry updated = store.getHistoryEntry(historyId).orElse(changed);

        eventHub.emitHistoryUpdate(agentId, updated, nextSequence());
        if (becameTerminal) {
            eventHub.emitHierarchicalHistoryUpdate(agentId, updated, registry);
        }
        return updated;
    }

    @Override
    public ExecutionEntry addStep(String historyId, HistoryStep step) {
        ExecutionEntry existing = store.getHistoryEntry(historyId)
                .orElseThrow(() -> new RecordNotFoundException("History entry", historyId));
        store.addHistoryStep(step, historyId, existing.agentId());
        ExecutionEntry updated = store.getHistoryEntry(historyId).orElse(existing);
        eventHub.emitHistoryUpdate(agentId, updated, nextSequence());
        return updated;
    }

    /**
     * Stores the event for this agent. When {@code historyId} belongs to another
     * agent (an event relayed from a sub-agent), the returned entry is that run
     * as this agent sees it: the sub-agent's entry with this agent's events.
     */
    @Override
    public Optional<ExecutionEntry> persistTimelineEvent(String historyId, TimelineEvent event) {
        store.addTimelineEvent(event, historyId, agentId);
        Optional<ExecutionEntry> entry = store.getHistoryEntry(historyId)
                .map(found -> agentId.equals(found.agentId())
                        ? found
                        : found.withSteps(List.of()).withEvents(store.getTimelineEvents(historyId, agentId)));
        if (entry.isEmpty()) {
            log.debug("Timeline event {} stored for unknown entry {}", event.id(), historyId);
            return entry;
        }
        eventHub.emitHistoryUpdate(agentId, entry.get(), nextSequence());
        return entry;
    }

    @Override
    public List<ExecutionEntry> getEntries() {
        return store.getAllHistoryEntriesByAgent(agentId);
    }

    private long nextSequence() {
        long now = clock.millis();
        return lastSequence.updateAndGet(last -> Math.max(last + 1, now));
    }

    public String getAgentId() {
        return agentId;
    }
}

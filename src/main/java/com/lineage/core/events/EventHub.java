package com.lineage.core.events;

import com.lineage.core.logging.MdcContext;
import com.lineage.core.metrics.LineageMetrics;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.TimelineEvent;
import com.lineage.core.registry.Agent;
import com.lineage.core.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub hub for agent lifecycle and execution history events.
 * <p>
 * Listeners are invoked synchronously on the publishing thread in
 * registration order. A listener that throws is logged and skipped; the
 * remaining listeners still receive the event.
 * <p>
 * The hub also relays history changes up the agent hierarchy: every ancestor
 * of the originating agent receives a synthesized "agent" timeline event,
 * persisted through that ancestor's {@link com.lineage.core.registry.HistoryManager}.
 */
@Service
public class EventHub {

    private static final Logger log = LoggerFactory.getLogger(EventHub.class);

    private final Channel<String> agentRegistered = new Channel<>("agentRegistered");
    private final Channel<String> agentUnregistered = new Channel<>("agentUnregistered");
    private final Channel<HistoryNotification> historyUpdate = new Channel<>("historyUpdate");
    private final Channel<HistoryNotification> historyEntryCreated = new Channel<>("historyEntryCreated");

    private final LineageMetrics metrics;
    private final Clock clock;

    public EventHub() {
        this(null, Clock.systemUTC());
    }

    @Autowired
    public EventHub(@Autowired(required = false) LineageMetrics metrics) {
        this(metrics, Clock.systemUTC());
    }

    EventHub(LineageMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Subscriptions ────────────────────────────────────────────────────

    public Subscription onAgentRegistered(Consumer<String> listener) {
        return agentRegistered.add(listener);
    }

    public Subscription onAgentUnregistered(Consumer<String> listener) {
        return agentUnregistered.add(listener);
    }

    public Subscription onHistoryUpdate(Consumer<HistoryNotification> listener) {
        return historyUpdate.add(listener);
    }

    public Subscription onHistoryEntryCreated(Consumer<HistoryNotification> listener) {
        return historyEntryCreated.add(listener);
    }

    /**
     * Drops every listener on every channel.
     */
    public void reset() {
        agentRegistered.clear();
        agentUnregistered.clear();
        historyUpdate.clear();
        historyEntryCreated.clear();
        log.debug("Event hub reset");
    }

    public int listenerCount() {
        return agentRegistered.size() + agentUnregistered.size()
                + historyUpdate.size() + historyEntryCreated.size();
    }

    // ── Emission ─────────────────────────────────────────────────────────

    public void emitAgentRegistered(String agentId) {
        agentRegistered.emit(agentId);
    }

    public void emitAgentUnregistered(String agentId) {
        agentUnregistered.emit(agentId);
    }

    public void emitHistoryEntryCreated(String agentId, ExecutionEntry entry) {
        historyEntryCreated.emit(new HistoryNotification(agentId, entry));
    }

    public void emitHistoryUpdate(String agentId, ExecutionEntry entry) {
        historyUpdate.emit(new HistoryNotification(agentId, entry));
    }

    public void emitHistoryUpdate(String agentId, ExecutionEntry entry, Long sequenceNumber) {
        historyUpdate.emit(new HistoryNotification(agentId, entry, sequenceNumber));
    }

    // ── Timeline publishing ──────────────────────────────────────────────

    /**
     * Persists {@code event} under {@code historyId} through the agent's history manager.
     *
     * @return the persisted entry, or empty when the agent is not registered
     *         (it may have been removed while the event was in flight)
     */
    public Optional<ExecutionEntry> publishTimelineEvent(String agentId, String historyId,
                                                         TimelineEvent event, AgentRegistry registry) {
        Optional<Agent> agent = registry.getAgent(agentId);
        if (agent.isEmpty()) {
            log.debug("Agent {} not registered, dropping timeline event {}", agentId, event.name());
            if (metrics != null) {
                metrics.recordTimelineEventPublished(false);
            }
            return Optional.empty();
        }
        try (MdcContext.Scope ignored = MdcContext.scoped(agentId, historyId)) {
            Optional<ExecutionEntry> persisted = agent.get().getHistoryManager().persistTimelineEvent(historyId, event);
            if (metrics != null) {
                metrics.recordTimelineEventPublished(true);
            }
            return persisted;
        }
    }

    /**
     * Relays the creation of {@code entry} to every ancestor of {@code originAgentId}
     * as an "agent:start" event.
     */
    public void emitHierarchicalHistoryEntryCreated(String originAgentId, ExecutionEntry entry,
                                                    AgentRegistry registry) {
        propagate(originAgentId, entry, registry, false);
    }

    /**
     * Relays a status change of {@code entry} to every ancestor of {@code originAgentId}:
     * completed as "agent:success", error as "agent:error", anything else as "agent:start".
     */
    public void emitHierarchicalHistoryUpdate(String originAgentId, ExecutionEntry entry,
                                              AgentRegistry registry) {
        propagate(originAgentId, entry, registry, true);
    }

    /*
     * Depth-first walk over child->parent hops with an explicit stack. Each agent
     * is expanded at most once, so every directed edge is relayed at most once and
     * cyclic graphs terminate. Hops run one after another, descendants first.
     */
    private void propagate(String originAgentId, ExecutionEntry entry, AgentRegistry registry, boolean update) {
        Deque<PropagatedEvents.Hop> pending = new ArrayDeque<>();
        Set<String> expanded = new HashSet<>();
        expanded.add(originAgentId);
        pushParents(pending, originAgentId, registry);

        while (!pending.isEmpty()) {
            PropagatedEvents.Hop hop = pending.pop();
            Optional<Agent> parent = registry.getAgent(hop.parentId());
            if (parent.isEmpty()) {
                log.debug("Parent agent {} of {} not registered, stopping this branch", hop.parentId(), hop.childId());
                continue;
            }

            String displayName = registry.getAgent(hop.childId())
                    .map(Agent::getName)
                    .orElse(hop.childId());
            TimelineEvent event = update
                    ? PropagatedEvents.updated(entry, hop, displayName, clock.instant())
                    : PropagatedEvents.created(entry, hop, displayName, clock.instant());
            try {
                publishTimelineEvent(hop.parentId(), entry.id(), event, registry);
                if (metrics != null) {
                    metrics.recordPropagationHop(event.name());
                }
            } catch (RuntimeException e) {
                log.warn("Failed to relay {} from {} to {}: {}",
                        event.name(), hop.childId(), hop.parentId(), e.getMessage(), e);
            }

            if (expanded.add(hop.parentId())) {
                pushParents(pending, hop.parentId(), registry);
            }
        }
    }

    // Pushed in reverse so the first registered parent is relayed first.
    private static void pushParents(Deque<PropagatedEvents.Hop> pending, String childId, AgentRegistry registry) {
        List<String> parents = registry.getParentAgentIds(childId);
        if (parents == null) {
            return;
        }
        for (int i = parents.size() - 1; i >= 0; i--) {
            pending.push(new PropagatedEvents.Hop(childId, parents.get(i)));
        }
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static final class Channel<T> {

        private final String name;
        private final CopyOnWriteArrayList<Listener<T>> listeners = new CopyOnWriteArrayList<>();

        Channel(String name) {
            this.name = name;
        }

        Subscription add(Consumer<T> consumer) {
            Listener<T> listener = new Listener<>(consumer);
            listeners.add(listener);
            return () -> listeners.remove(listener);
        }

        void emit(T payload) {
            for (Listener<T> listener : listeners) {
                try {
                    listener.consumer.accept(payload);
                } catch (Exception e) {
                    log.warn("Listener threw exception processing {} event: {}", name, e.getMessage(), e);
                }
            }
        }

        void clear() {
            listeners.clear();
        }

        int size() {
            return listeners.size();
        }
    }

    // Identity-compared so registering the same consumer twice yields two independent handles.
    private static final class Listener<T> {
        private final Consumer<T> consumer;

        Listener(Consumer<T> consumer) {
            this.consumer = consumer;
        }
    }
}

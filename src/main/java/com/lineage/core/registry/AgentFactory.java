package com.lineage.core.registry;

import com.lineage.core.events.EventHub;
import com.lineage.core.persistence.DurableTimelineStore;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates store-backed agents and registers them with the local registry.
 */
@Component
public class AgentFactory {

    private final DurableTimelineStore store;
    private final EventHub eventHub;
    private final LocalAgentRegistry registry;
    private final Clock clock;

    public AgentFactory(DurableTimelineStore store, EventHub eventHub, LocalAgentRegistry registry, Clock clock) {
        this.store = store;
        this.eventHub = eventHub;
        this.registry = registry;
        this.clock = clock;
    }

    public TrackedAgent create(String id, String name) {
        return new TrackedAgent(id, name, new PersistentHistoryManager(id, store, eventHub, registry, clock));
    }

    public TrackedAgent register(String id, String name) {
        TrackedAgent agent = create(id, name);
        registry.registerAgent(agent);
        return agent;
    }

    /**
     * Registers {@code child} under {@code parent}, creating neither agent.
     */
    public void attachSubAgent(String parentId, String childId) {
        registry.registerSubAgent(parentId, childId);
    }
}

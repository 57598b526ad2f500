package com.lineage.core.registry;

import com.lineage.core.events.EventHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory agent registry holding the agents of this process and their
 * parent/sub-agent relationships.
 * <p>
 * Relationships are stored child-to-parents, so a sub-agent shared by several
 * parents relays its history to each of them.
 */
@Component
public class LocalAgentRegistry implements AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentRegistry.class);

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<String>> parentsByChild = new ConcurrentHashMap<>();
    private final EventHub eventHub;

    public LocalAgentRegistry(EventHub eventHub) {
        this.eventHub = eventHub;
    }

    /**
     * Registers an agent and announces it on the hub.
     *
     * @throws IllegalArgumentException if the id is blank or already registered
     */
    public void registerAgent(Agent agent) {
        if (agent == null || agent.getId() == null || agent.getId().isBlank()) {
            throw new IllegalArgumentException("Agent and agent id must not be blank");
        }
        if (agents.putIfAbsent(agent.getId(), agent) != null) {
            throw new IllegalArgumentException("Agent already registered: " + agent.getId());
        }
        log.info("Registered agent {} ({})", agent.getId(), agent.getName());
        eventHub.emitAgentRegistered(agent.getId());
    }

    @Override
    public Optional<Agent> getAgent(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    public List<Agent> getAllAgents() {
        return List.copyOf(agents.values());
    }

    public List<String> getAgentIds() {
        return List.copyOf(agents.keySet());
    }

    public boolean hasAgent(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public int getAgentCount() {
        return agents.size();
    }

    /**
     * Records {@code childId} as a sub-agent of {@code parentId}. Registering the
     * same pair twice has no effect.
     */
    public void registerSubAgent(String parentId, String childId) {
        if (parentId == null || childId == null) {
            throw new IllegalArgumentException("Parent and child ids must not be null");
        }
        List<String> parents = parentsByChild.computeIfAbsent(childId, k -> new CopyOnWriteArrayList<>());
        if (!parents.contains(parentId)) {
            parents.add(parentId);
            log.debug("Registered {} as sub-agent of {}", childId, parentId);
        }
    }

    public void unregisterSubAgent(String parentId, String childId) {
        parentsByChild.computeIfPresent(childId, (k, parents) -> {
            parents.remove(parentId);
            return parents.isEmpty() ? null : parents;
        });
    }

    @Override
    public List<String> getParentAgentIds(String agentId) {
        List<String> parents = parentsByChild.get(agentId);
        return parents == null ? List.of() : List.copyOf(parents);
    }

    /**
     * Removes every relationship in which {@code agentId} is either the child or a parent.
     */
    public void clearAgentRelationships(String agentId) {
        parentsByChild.remove(agentId);
        for (String childId : new ArrayList<>(parentsByChild.keySet())) {
            unregisterSubAgent(agentId, childId);
        }
    }

    /**
     * Removes an agent and its relationships, announcing the removal on the hub.
     *
     * @return true if the agent was registered
     */
    public boolean removeAgent(String agentId) {
        Agent removed = agentId == null ? null : agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        clearAgentRelationships(agentId);
        log.info("Removed agent {}", agentId);
        eventHub.emitAgentUnregistered(agentId);
        return true;
    }

    public void clear() {
        agents.clear();
        parentsByChild.clear();
    }
}

package com.lineage.core.registry;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the agent graph consumed by event propagation.
 */
public interface AgentRegistry {

    Optional<Agent> getAgent(String agentId);

    /**
     * Ids of the agents that use {@code agentId} as a sub-agent, in registration
     * order. Empty for root agents.
     */
    List<String> getParentAgentIds(String agentId);
}

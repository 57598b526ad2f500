package com.lineage.core.events;

import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.HistoryStep;
import com.lineage.core.model.TimelineEvent;
import com.lineage.core.registry.Agent;
import com.lineage.core.registry.AgentRegistry;
import com.lineage.core.registry.HistoryManager;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory agent graph whose history managers record every published event.
 */
class AgentGraphFixture implements AgentRegistry {

    record Published(String agentId, String historyId, TimelineEvent event) {}

    final List<Published> published = new ArrayList<>();
    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final Map<String, List<String>> parents = new HashMap<>();
    private final Set<String> failing = new HashSet<>();

    AgentGraphFixture agent(String id, String name) {
        agents.put(id, new RecordingAgent(id, name));
        return this;
    }

    AgentGraphFixture agents(String... ids) {
        for (String id : ids) {
            agent(id, "Agent " + id);
        }
        return this;
    }

    AgentGraphFixture edge(String childId, String parentId) {
        parents.computeIfAbsent(childId, k -> new ArrayList<>()).add(parentId);
        return this;
    }

    AgentGraphFixture failOn(String agentId) {
        failing.add(agentId);
        return this;
    }

    List<Published> publishedTo(String agentId) {
        return published.stream().filter(p -> p.agentId().equals(agentId)).toList();
    }

    @Override
    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public List<String> getParentAgentIds(String agentId) {
        return parents.getOrDefault(agentId, List.of());
    }

    private final class RecordingAgent implements Agent, HistoryManager {

        private final String id;
        private final String name;

        RecordingAgent(String id, String name) {
            this.id = id;
            this.name = name;
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
            return List.of();
        }

        @Override
        public HistoryManager getHistoryManager() {
            return this;
        }

        @Override
        public Optional<ExecutionEntry> persistTimelineEvent(String historyId, TimelineEvent event) {
            if (failing.contains(id)) {
                throw new IllegalStateException("store unavailable for " + id);
            }
            published.add(new Published(id, historyId, event));
            return Optional.empty();
        }

        @Override
        public ExecutionEntry addEntry(Object input) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ExecutionEntry updateEntry(String historyId, AgentStatus status, Object output,
                                          Map<String, Object> usage) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ExecutionEntry addStep(String historyId, HistoryStep step) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<ExecutionEntry> getEntries() {
            return List.of();
        }
    }
}

package com.lineage.core.events;

import com.lineage.core.metrics.LineageMetrics;
import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.EventLevel;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.TimelineEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for relaying history changes up the agent hierarchy.
 */
class HierarchicalPropagationTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private SimpleMeterRegistry meters;
    private EventHub hub;
    private ExecutionEntry entry;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        hub = new EventHub(new LineageMetrics(meters), Clock.fixed(NOW, ZoneOffset.UTC));
        entry = ExecutionEntry.started("h-1", "C", "analyze", Instant.parse("2025-03-01T11:59:00Z"));
    }

    @Nested
    @DisplayName("entry created")
    class EntryCreated {

        @Test
        @DisplayName("walks a chain nearest ancestor first")
        void walksChain() {
            var graph = new AgentGraphFixture().agents("A", "B").agent("C", "Researcher")
                    .edge("C", "B").edge("B", "A");

            hub.emitHierarchicalHistoryEntryCreated("C", entry, graph);

            assertEquals(2, graph.published.size());
            var toB = graph.published.get(0);
            var toA = graph.published.get(1);
            assertEquals("B", toB.agentId());
            assertEquals("A", toA.agentId());

            assertEquals("h-1", toB.historyId());
            assertEquals("agent", toB.event().type());
            assertEquals("agent:start", toB.event().name());
            assertEquals("running", toB.event().status());
            assertEquals("analyze", toB.event().input());
            assertEquals("Researcher", toB.event().metadata().get("displayName"));
            assertEquals("C", toB.event().metadata().get("id"));
            assertEquals("B", toB.event().metadata().get("agentId"));

            assertEquals("B", toA.event().metadata().get("id"));
            assertEquals("A", toA.event().metadata().get("agentId"));
            assertEquals("Agent B", toA.event().metadata().get("displayName"));
        }

        @Test
        @DisplayName("root agent publishes nothing")
        void rootAgentPublishesNothing() {
            var graph = new AgentGraphFixture().agents("C");

            hub.emitHierarchicalHistoryEntryCreated("C", entry, graph);

            assertTrue(graph.published.isEmpty());
        }

        @Test
        @DisplayName("two-agent cycle terminates after one relay per edge")
        void cycleTerminates() {
            var graph = new AgentGraphFixture().agents("A", "B").edge("A", "B").edge("B", "A");
            var fromA = ExecutionEntry.started("h-2", "A", null, NOW);

            hub.emitHierarchicalHistoryEntryCreated("A", fromA, graph);

            assertEquals(2, graph.published.size());
            assertEquals("B", graph.published.get(0).agentId());
            assertEquals("A", graph.published.get(1).agentId());
        }

        @Test
        @DisplayName("self loop relays once")
        void selfLoop() {
            var graph = new AgentGraphFixture().agents("A").edge("A", "A");

            hub.emitHierarchicalHistoryEntryCreated("A", ExecutionEntry.started("h", "A", null, NOW), graph);

            assertEquals(1, graph.published.size());
        }

        @Test
        @DisplayName("diamond delivers one event per incoming edge to the shared ancestor")
        void diamond() {
            var graph = new AgentGraphFixture().agents("A", "B", "C", "D")
                    .edge("D", "B").edge("D", "C").edge("B", "A").edge("C", "A");
            var fromD = ExecutionEntry.started("h-3", "D", null, NOW);

            hub.emitHierarchicalHistoryEntryCreated("D", fromD, graph);

            assertEquals(4, graph.published.size());
            assertEquals(1, graph.publishedTo("B").size());
            assertEquals(1, graph.publishedTo("C").size());
            var toA = graph.publishedTo("A");
            assertEquals(2, toA.size());
            assertEquals(Set.of("B", "C"),
                    Set.of(toA.get(0).event().metadata().get("id"), toA.get(1).event().metadata().get("id")));
        }

        @Test
        @DisplayName("unregistered parent ends that branch only")
        void missingParentEndsBranch() {
            var graph = new AgentGraphFixture().agents("A", "C")
                    .edge("C", "ghost").edge("C", "A").edge("ghost", "A");

            hub.emitHierarchicalHistoryEntryCreated("C", entry, graph);

            assertEquals(1, graph.published.size());
            assertEquals("A", graph.published.get(0).agentId());
        }

        @Test
        @DisplayName("failing hop is logged and the walk continues")
        void failingHopContinues() {
            var graph = new AgentGraphFixture().agents("A", "B", "C")
                    .edge("C", "B").edge("C", "A").edge("B", "A")
                    .failOn("B");

            hub.emitHierarchicalHistoryEntryCreated("C", entry, graph);

            assertTrue(graph.publishedTo("B").isEmpty());
            // B still expands after its own hop failed, so A hears from both B and C
            assertEquals(2, graph.publishedTo("A").size());
        }

        @Test
        @DisplayName("display name falls back to the child id")
        void displayNameFallsBackToId() {
            var graph = new AgentGraphFixture().agents("A").edge("orphan", "A");

            hub.emitHierarchicalHistoryEntryCreated("orphan", ExecutionEntry.started("h", "orphan", null, NOW), graph);

            assertEquals("orphan", graph.published.get(0).event().metadata().get("displayName"));
        }

        @Test
        @DisplayName("records one hop metric per relay")
        void recordsHopMetric() {
            var graph = new AgentGraphFixture().agents("A", "B", "C").edge("C", "B").edge("B", "A");

            hub.emitHierarchicalHistoryEntryCreated("C", entry, graph);

            var counter = meters.find("lineage.propagation.hops").tag("event", "agent:start").counter();
            assertNotNull(counter);
            assertEquals(2.0, counter.count());
        }
    }

    @Nested
    @DisplayName("entry updated")
    class EntryUpdated {

        private AgentGraphFixture graph;

        @BeforeEach
        void setUp() {
            graph = new AgentGraphFixture().agents("A", "C").edge("C", "A");
        }

        @Test
        @DisplayName("completed relays agent:success with output and end time")
        void completed() {
            Instant end = Instant.parse("2025-03-01T12:00:05Z");
            var done = entry.withStatus(AgentStatus.COMPLETED, "report", end);

            hub.emitHierarchicalHistoryUpdate("C", done, graph);

            TimelineEvent event = graph.published.get(0).event();
            assertEquals("agent:success", event.name());
            assertEquals("completed", event.status());
            assertEquals("report", event.output());
            assertEquals(end, event.endTime());
            assertEquals(EventLevel.INFO, event.level());
        }

        @Test
        @DisplayName("error relays agent:error with level ERROR and the output as message")
        void error() {
            var failed = entry.withStatus(AgentStatus.ERROR, "rate limited", null);

            hub.emitHierarchicalHistoryUpdate("C", failed, graph);

            TimelineEvent event = graph.published.get(0).event();
            assertEquals("agent:error", event.name());
            assertEquals("error", event.status());
            assertEquals(EventLevel.ERROR, event.level());
            assertEquals("rate limited", event.statusMessage().message());
            assertEquals(NOW, event.endTime());
        }

        @Test
        @DisplayName("running relays agent:start")
        void running() {
            hub.emitHierarchicalHistoryUpdate("C", entry, graph);

            assertEquals("agent:start", graph.published.get(0).event().name());
        }
    }

    @Nested
    @DisplayName("random graphs")
    class RandomGraphs {

        @RepeatedTest(25)
        @DisplayName("every edge reachable from the origin is relayed exactly once")
        void everyReachableEdgeOnce(RepetitionInfo info) {
            Random random = new Random(info.getCurrentRepetition());
            int size = 2 + random.nextInt(7);
            var graph = new AgentGraphFixture();
            String[] ids = new String[size];
            for (int i = 0; i < size; i++) {
                ids[i] = "n" + i;
            }
            graph.agents(ids);

            Set<List<String>> edges = new HashSet<>();
            for (String child : ids) {
                for (String parent : ids) {
                    if (random.nextInt(4) == 0) {
                        edges.add(List.of(child, parent));
                        graph.edge(child, parent);
                    }
                }
            }

            hub.emitHierarchicalHistoryEntryCreated("n0", ExecutionEntry.started("h", "n0", null, NOW), graph);

            Set<String> reachable = reachableFrom("n0", graph);
            long expected = edges.stream().filter(e -> reachable.contains(e.get(0))).count();
            assertEquals(expected, graph.published.size());

            Set<List<String>> relayed = new HashSet<>();
            for (var p : graph.published) {
                String child = (String) p.event().metadata().get("id");
                assertTrue(relayed.add(List.of(child, p.agentId())), "edge relayed twice: " + child + "->" + p.agentId());
            }
        }

        private Set<String> reachableFrom(String origin, AgentGraphFixture graph) {
            Set<String> seen = new HashSet<>();
            Deque<String> todo = new ArrayDeque<>();
            seen.add(origin);
            todo.push(origin);
            while (!todo.isEmpty()) {
                for (String parent : graph.getParentAgentIds(todo.pop())) {
                    if (seen.add(parent)) {
                        todo.push(parent);
                    }
                }
            }
            return seen;
        }
    }
}

package com.lineage.core.registry;

import com.lineage.core.events.EventHub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class LocalAgentRegistryTest {

    private EventHub hub;
    private LocalAgentRegistry registry;
    private final List<String> registered = new ArrayList<>();
    private final List<String> unregistered = new ArrayList<>();

    @BeforeEach
    void setUp() {
        hub = new EventHub();
        hub.onAgentRegistered(registered::add);
        hub.onAgentUnregistered(unregistered::add);
        registry = new LocalAgentRegistry(hub);
    }

    private Agent agent(String id) {
        return new TrackedAgent(id, "Agent " + id, mock(HistoryManager.class));
    }

    @Nested
    @DisplayName("agents")
    class Agents {

        @Test
        @DisplayName("registering announces the agent and makes it resolvable")
        void register() {
            registry.registerAgent(agent("a"));

            assertTrue(registry.hasAgent("a"));
            assertEquals("Agent a", registry.getAgent("a").orElseThrow().getName());
            assertEquals(1, registry.getAgentCount());
            assertEquals(List.of("a"), registered);
        }

        @Test
        void rejectsDuplicatesAndBlankIds() {
            registry.registerAgent(agent("a"));

            assertThrows(IllegalArgumentException.class, () -> registry.registerAgent(agent("a")));
            assertThrows(IllegalArgumentException.class, () -> registry.registerAgent(agent(" ")));
            assertThrows(IllegalArgumentException.class, () -> registry.registerAgent(null));
            assertEquals(List.of("a"), registered);
        }

        @Test
        void unknownAndNullIdsResolveToEmpty() {
            assertTrue(registry.getAgent("missing").isEmpty());
            assertTrue(registry.getAgent(null).isEmpty());
            assertFalse(registry.hasAgent(null));
        }

        @Test
        @DisplayName("removing drops relationships and announces the removal")
        void remove() {
            registry.registerAgent(agent("parent"));
            registry.registerAgent(agent("child"));
            registry.registerSubAgent("parent", "child");

            assertTrue(registry.removeAgent("parent"));
            assertFalse(registry.removeAgent("parent"));

            assertEquals(List.of(), registry.getParentAgentIds("child"));
            assertEquals(List.of("parent"), unregistered);
        }
    }

    @Nested
    @DisplayName("relationships")
    class Relationships {

        @Test
        @DisplayName("parents are kept in registration order without duplicates")
        void parentsInOrder() {
            registry.registerSubAgent("p1", "c");
            registry.registerSubAgent("p2", "c");
            registry.registerSubAgent("p1", "c");

            assertEquals(List.of("p1", "p2"), registry.getParentAgentIds("c"));
            assertEquals(List.of(), registry.getParentAgentIds("p1"));
        }

        @Test
        void unregisterRemovesOnlyThatEdge() {
            registry.registerSubAgent("p1", "c");
            registry.registerSubAgent("p2", "c");

            registry.unregisterSubAgent("p1", "c");

            assertEquals(List.of("p2"), registry.getParentAgentIds("c"));
        }

        @Test
        @DisplayName("clearing an agent removes it as child and as parent")
        void clearRelationships() {
            registry.registerSubAgent("root", "mid");
            registry.registerSubAgent("mid", "leaf");
            registry.registerSubAgent("other", "leaf");

            registry.clearAgentRelationships("mid");

            assertEquals(List.of(), registry.getParentAgentIds("mid"));
            assertEquals(List.of("other"), registry.getParentAgentIds("leaf"));
        }

        @Test
        void returnedListIsASnapshot() {
            registry.registerSubAgent("p1", "c");
            List<String> parents = registry.getParentAgentIds("c");

            registry.registerSubAgent("p2", "c");

            assertEquals(List.of("p1"), parents);
            assertThrows(UnsupportedOperationException.class, () -> parents.add("x"));
        }

        @Test
        void nullIdsAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> registry.registerSubAgent(null, "c"));
        }
    }
}

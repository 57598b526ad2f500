package com.lineage.core.persistence;

import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.Conversation;
import com.lineage.core.model.ConversationMessage;
import com.lineage.core.model.EventLevel;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.HistoryStep;
import com.lineage.core.model.StatusMessage;
import com.lineage.core.model.TimelineEvent;
import com.lineage.core.persistence.ConversationQuery.SortColumn;
import com.lineage.core.persistence.ConversationQuery.SortDirection;
import com.lineage.core.persistence.DurableTimelineStore.TableFamily;
import com.lineage.core.persistence.migration.MigrationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link DurableTimelineStore} against a real SQLite file.
 */
class DurableTimelineStoreTest {

    private static final Instant T0 = Instant.parse("2025-02-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private StorageProperties properties;
    private DurableTimelineStore store;

    @BeforeEach
    void setUp() {
        dataSource = SqliteTestSupport.dataSource(tempDir);
        properties = new StorageProperties();
        store = new DurableTimelineStore(dataSource, properties, new SqliteTestSupport.TickingClock(T0), null);
        store.initialize();
    }

    private Conversation conversation(String id, String userId, String resourceId, String title) {
        return store.createConversation(new Conversation(id, resourceId, userId, title, Map.of(), null, null));
    }

    private ConversationMessage message(String id, String role, String content) {
        return new ConversationMessage(id, role, content, "text", null);
    }

    // -- Lifecycle ------------------------------------------------------------

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        @DisplayName("creates every table with the configured prefix")
        void createsTables() throws SQLException {
            TableNames tables = store.tableNames();
            for (String table : List.of(tables.conversations(), tables.messages(), tables.history(),
                    tables.steps(), tables.events(), tables.migrationFlags())) {
                assertTrue(SqliteTestSupport.tableExists(dataSource, table), table);
            }
            assertTrue(tables.history().startsWith("lineage_memory_"));
        }

        @Test
        @DisplayName("every family is ready on a fresh database")
        void freshDatabaseIsReady() {
            assertTrue(store.isReady());
            for (TableFamily family : TableFamily.values()) {
                assertEquals(MigrationState.READY, store.getMigrationState(family));
            }
        }

        @Test
        @DisplayName("is idempotent")
        void idempotent() {
            store.addHistoryEntry(ExecutionEntry.started("h-1", "agent-1", "in", T0));

            assertDoesNotThrow(() -> store.initialize());

            assertTrue(store.getHistoryEntry("h-1").isPresent());
        }

        @Test
        @DisplayName("custom prefix is applied")
        void customPrefix() throws SQLException {
            properties.setTablePrefix("custom");
            var custom = new DurableTimelineStore(dataSource, properties);
            custom.initialize();

            assertTrue(SqliteTestSupport.tableExists(dataSource, "custom_agent_history_timeline_events"));
        }

        @Test
        @DisplayName("rejects a prefix that is not a plain identifier")
        void rejectsUnsafePrefix() {
            properties.setTablePrefix("x; DROP TABLE y");
            assertThrows(IllegalArgumentException.class, () -> new DurableTimelineStore(dataSource, properties));
        }
    }

    // -- Agent history --------------------------------------------------------

    @Nested
    @DisplayName("agent history")
    class AgentHistory {

        @Test
        @DisplayName("stores an entry and joins its steps and events")
        void storesEntryWithChildren() {
            store.addHistoryEntry(ExecutionEntry.started("h-1", "agent-1", Map.of("q", "hello"), T0));
            store.addHistoryStep(new HistoryStep("s-1", "text", "think", "pondering", null), "h-1", "agent-1");
            store.addTimelineEvent(TimelineEvent.builder()
                    .id("e-1").type("tool").name("tool:start").startTime(T0).status(AgentStatus.RUNNING)
                    .metadata("displayName", "search").build(), "h-1", "agent-1");

            ExecutionEntry loaded = store.getHistoryEntry("h-1").orElseThrow();

            assertEquals("agent-1", loaded.agentId());
            assertEquals(AgentStatus.RUNNING, loaded.status());
            assertEquals(Map.of("q", "hello"), loaded.input());
            assertEquals(T0, loaded.startTime());
            assertEquals(1, loaded.steps().size());
            assertEquals("pondering", loaded.steps().get(0).content());
            assertEquals(1, loaded.events().size());
            TimelineEvent event = loaded.events().get(0);
            assertEquals("tool:start", event.name());
            assertEquals("running", event.status());
            assertEquals("search", event.metadata().get("displayName"));
        }

        @Test
        @DisplayName("events recorded by another agent are not joined")
        void otherAgentsEventsNotJoined() {
            store.addHistoryEntry(ExecutionEntry.started("h-1", "child", null, T0));
            store.addTimelineEvent(TimelineEvent.builder().name("agent:start").type("agent").build(), "h-1", "parent");

            assertTrue(store.getHistoryEntry("h-1").orElseThrow().events().isEmpty());
            assertEquals(1, store.getTimelineEvents("h-1", "parent").size());
        }

        @Test
        @DisplayName("error event keeps level and status message")
        void errorEventFields() {
            store.addHistoryEntry(ExecutionEntry.started("h-1", "agent-1", null, T0));
            store.addTimelineEvent(TimelineEvent.builder()
                    .id("e-err").type("agent").name("agent:error").status(AgentStatus.ERROR)
                    .level(EventLevel.ERROR).statusMessage(StatusMessage.of("boom"))
                    .startTime(T0).endTime(T0.plusSeconds(3)).build(), "h-1", "agent-1");

            TimelineEvent event = store.getTimelineEvents("h-1", "agent-1").get(0);

            assertEquals(EventLevel.ERROR, event.level());
            assertEquals("boom", event.statusMessage().message());
            assertEquals(T0.plusSeconds(3), event.endTime());
        }

        @Test
        @DisplayName("update rewrites status, output and end time")
        void updateRewritesEntry() {
            var entry = ExecutionEntry.started("h-1", "agent-1", "in", T0);
            store.addHistoryEntry(entry);
            Instant end = T0.plusSeconds(30);

            store.updateHistoryEntry(entry.withStatus(AgentStatus.COMPLETED, "out", end)
                    .withUsage(Map.of("totalTokens", 12)));

            ExecutionEntry loaded = store.getHistoryEntry("h-1").orElseThrow();
            assertEquals(AgentStatus.COMPLETED, loaded.status());
            assertEquals("out", loaded.output());
            assertEquals(end, loaded.endTime());
            assertEquals(12, ((Number) loaded.usage().get("totalTokens")).intValue());
            assertFalse(loaded.metadata().containsKey("endTime"));
        }

        @Test
        @DisplayName("updating a missing entry throws RecordNotFoundException")
        void updateMissingEntry() {
            var missing = ExecutionEntry.started("nope", "agent-1", null, T0);
            var ex = assertThrows(RecordNotFoundException.class, () -> store.updateHistoryEntry(missing));
            assertEquals("nope", ex.getRecordId());
        }

        @Test
        @DisplayName("missing entry reads as empty")
        void missingEntryIsEmpty() {
            assertTrue(store.getHistoryEntry("nope").isEmpty());
            assertTrue(store.getHistoryStep("nope").isEmpty());
            assertTrue(store.getAllHistoryEntriesByAgent("nobody").isEmpty());
        }

        @Test
        @DisplayName("lists an agent's entries oldest first")
        void listsOldestFirst() {
            store.addHistoryEntry(ExecutionEntry.started("late", "agent-1", null, T0.plusSeconds(60)));
            store.addHistoryEntry(ExecutionEntry.started("early", "agent-1", null, T0));
            store.addHistoryEntry(ExecutionEntry.started("other", "agent-2", null, T0));

            var ids = store.getAllHistoryEntriesByAgent("agent-1").stream().map(ExecutionEntry::id).toList();

            assertEquals(List.of("early", "late"), ids);
        }

        @Test
        @DisplayName("clearHistory removes entries, steps and events of one agent")
        void clearHistory() throws SQLException {
            store.addHistoryEntry(ExecutionEntry.started("h-1", "agent-1", null, T0));
            store.addHistoryStep(new HistoryStep("s-1", "text", null, "x", null), "h-1", "agent-1");
            store.addTimelineEvent(TimelineEvent.builder().name("agent:start").type("agent").build(), "h-1", "agent-1");
            store.addHistoryEntry(ExecutionEntry.started("h-2", "agent-2", null, T0));

            assertEquals(1, store.clearHistory("agent-1"));

            assertTrue(store.getHistoryEntry("h-1").isEmpty());
            assertTrue(store.getHistoryEntry("h-2").isPresent());
            assertEquals(0, SqliteTestSupport.count(dataSource, store.tableNames().steps()));
            assertEquals(0, SqliteTestSupport.count(dataSource, store.tableNames().events()));
        }
    }

    // -- Conversations --------------------------------------------------------

    @Nested
    @DisplayName("conversations")
    class Conversations {

        @Test
        @DisplayName("create defaults the owner and timestamps")
        void createDefaults() {
            Conversation created = conversation("c-1", null, "res-1", "Chat");

            assertEquals("default", created.userId());
            assertNotNull(created.createdAt());
            assertEquals(created, store.getConversation("c-1").orElseThrow());
        }

        @Test
        @DisplayName("another user's conversation reads as not found")
        void userIsolation() {
            conversation("c-1", "alice", "res", "Alice's chat");

            assertTrue(store.getUserConversation("c-1", "alice").isPresent());
            assertTrue(store.getUserConversation("c-1", "bob").isEmpty());
        }

        @Test
        @DisplayName("filters by resource and user")
        void filters() {
            conversation("c-1", "alice", "res-a", "one");
            conversation("c-2", "alice", "res-b", "two");
            conversation("c-3", "bob", "res-a", "three");

            assertEquals(2, store.getConversations("res-a").size());
            var alice = store.getConversationsByUserId("alice", ConversationQuery.all());
            assertEquals(List.of("c-2", "c-1"), alice.stream().map(Conversation::id).toList());
        }

        @Test
        @DisplayName("sorts by a whitelisted column")
        void sortsByTitle() {
            conversation("c-1", "alice", "res", "banana");
            conversation("c-2", "alice", "res", "apple");
            conversation("c-3", "alice", "res", "cherry");

            var sorted = store.queryConversations(ConversationQuery.all().forUser("alice")
                    .sortedBy(SortColumn.TITLE, SortDirection.ASC));

            assertEquals(List.of("apple", "banana", "cherry"), sorted.stream().map(Conversation::title).toList());
        }

        @Test
        @DisplayName("paginates most recent first and reports hasMore")
        void paginates() {
            for (int i = 1; i <= 5; i++) {
                conversation("c-" + i, "alice", "res", "t" + i);
            }

            ConversationPage first = store.getPaginatedUserConversations("alice", 1, 2);
            ConversationPage last = store.getPaginatedUserConversations("alice", 3, 2);

            assertEquals(List.of("c-5", "c-4"), first.conversations().stream().map(Conversation::id).toList());
            assertTrue(first.hasMore());
            assertEquals(List.of("c-1"), last.conversations().stream().map(Conversation::id).toList());
            assertFalse(last.hasMore());
        }

        @Test
        @DisplayName("update changes the title and bumps updatedAt")
        void update() {
            Conversation created = conversation("c-1", "alice", "res", "old");

            Conversation updated = store.updateConversation("c-1", ConversationUpdate.title("new"));

            assertEquals("new", updated.title());
            assertEquals("res", updated.resourceId());
            assertTrue(updated.updatedAt().isAfter(created.updatedAt()));
        }

        @Test
        @DisplayName("updating a missing conversation throws")
        void updateMissing() {
            assertThrows(RecordNotFoundException.class,
                    () -> store.updateConversation("ghost", ConversationUpdate.title("x")));
        }

        @Test
        @DisplayName("delete removes the conversation and its messages")
        void delete() throws SQLException {
            conversation("c-1", "alice", "res", "t");
            store.addMessage("c-1", message("m-1", "user", "hi"));

            store.deleteConversation("c-1");

            assertTrue(store.getConversation("c-1").isEmpty());
            assertEquals(0, SqliteTestSupport.count(dataSource, store.tableNames().messages()));
        }
    }

    // -- Messages -------------------------------------------------------------

    @Nested
    @DisplayName("messages")
    class Messages {

        @BeforeEach
        void createConversations() {
            conversation("c-1", "alice", "res", "Alice");
            conversation("c-2", "bob", "res", "Bob");
        }

        @Test
        @DisplayName("prunes the oldest messages beyond the storage limit")
        void prunes() {
            properties.setStorageLimit(3);
            for (int i = 1; i <= 5; i++) {
                store.addMessage("c-1", message("m-" + i, "user", "msg " + i));
            }

            var ids = store.getConversationMessages("c-1", 0, 0).stream().map(ConversationMessage::id).toList();

            assertEquals(List.of("m-3", "m-4", "m-5"), ids);
        }

        @Test
        @DisplayName("limit keeps the newest messages in ascending order")
        void limitKeepsNewest() {
            for (int i = 1; i <= 4; i++) {
                store.addMessage("c-1", message("m-" + i, i % 2 == 0 ? "assistant" : "user", "msg " + i));
            }

            var latest = store.getMessages(MessageFilter.forConversation("alice", "c-1").withLimit(2));

            assertEquals(List.of("m-3", "m-4"), latest.stream().map(ConversationMessage::id).toList());
        }

        @Test
        @DisplayName("filters by role")
        void filtersByRole() {
            store.addMessage("c-1", message("m-1", "user", "q"));
            store.addMessage("c-1", message("m-2", "assistant", "a"));

            var answers = store.getMessages(MessageFilter.forConversation("alice", "c-1").withRole("assistant"));

            assertEquals(List.of("m-2"), answers.stream().map(ConversationMessage::id).toList());
        }

        @Test
        @DisplayName("a user never sees another user's messages")
        void userScoping() {
            store.addMessage("c-1", message("m-1", "user", "alice's secret"));

            assertTrue(store.getMessages(MessageFilter.forConversation("bob", "c-1")).isEmpty());
            assertEquals(1, store.getMessages(MessageFilter.forConversation("alice", "c-1")).size());
        }

        @Test
        @DisplayName("clearMessages leaves other users' conversations alone")
        void clearMessages() {
            store.addMessage("c-1", message("m-1", "user", "a"));
            store.addMessage("c-2", message("m-2", "user", "b"));

            assertEquals(1, store.clearMessages("alice", null));

            assertTrue(store.getConversationMessages("c-1", 10, 0).isEmpty());
            assertEquals(1, store.getConversationMessages("c-2", 10, 0).size());
        }

        @Test
        @DisplayName("time window filter")
        void timeWindow() {
            store.addMessage("c-1", new ConversationMessage("m-1", "user", "a", "text", T0));
            store.addMessage("c-1", new ConversationMessage("m-2", "user", "b", "text", T0.plusSeconds(10)));
            store.addMessage("c-1", new ConversationMessage("m-3", "user", "c", "text", T0.plusSeconds(20)));

            var middle = store.getMessages(MessageFilter.forConversation("alice", "c-1")
                    .between(T0.plusSeconds(5), T0.plusSeconds(15)));

            assertEquals(List.of("m-2"), middle.stream().map(ConversationMessage::id).toList());
        }
    }

    // -- Failures -------------------------------------------------------------

    @Nested
    @DisplayName("persistence failures")
    class Failures {

        @Test
        @DisplayName("wraps SQL errors with a stable message")
        void wrapsSqlErrors() throws SQLException {
            DataSource broken = mock(DataSource.class);
            when(broken.getConnection()).thenThrow(new SQLException("disk I/O error"));
            var failing = new DurableTimelineStore(broken, new StorageProperties());

            var ex = assertThrows(StorageException.class,
                    () -> failing.addMessage("c-1", message("m-1", "user", "x")));
            assertEquals("Failed to add message", ex.getMessage());
            assertInstanceOf(SQLException.class, ex.getCause());

            var create = assertThrows(StorageException.class,
                    () -> failing.createConversation(new Conversation("c", "r", "u", "t", null, null, null)));
            assertEquals("Failed to create conversation", create.getMessage());
        }

        @Test
        @DisplayName("values that cannot be serialized fail with the operation's message")
        void wrapsSerializationErrors() {
            Object unserializable = new Object();

            var entry = assertThrows(StorageException.class,
                    () -> store.addHistoryEntry(ExecutionEntry.started("h-x", "agent-1", unserializable, T0)));
            assertEquals("Failed to add history entry", entry.getMessage());
            assertInstanceOf(SQLException.class, entry.getCause());

            var event = assertThrows(StorageException.class,
                    () -> store.addTimelineEvent(TimelineEvent.builder().id("e-x").type("tool").name("tool:start")
                            .startTime(T0).input(unserializable).build(), "h-x", "agent-1"));
            assertEquals("Failed to add timeline event", event.getMessage());
            assertTrue(store.getTimelineEvents("h-x", "agent-1").isEmpty());
        }
    }
}
package com.lineage.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lineage.core.metrics.LineageMetrics;
import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.Conversation;
import com.lineage.core.model.ConversationMessage;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.HistoryStep;
import com.lineage.core.model.TimelineEvent;
import com.lineage.core.persistence.migration.AgentHistoryLogMigration;
import com.lineage.core.persistence.migration.ConversationSchemaMigration;
import com.lineage.core.persistence.migration.LegacyEventTransformer;
import com.lineage.core.persistence.migration.MigrationFlag;
import com.lineage.core.persistence.migration.MigrationFlagStore;
import com.lineage.core.persistence.migration.MigrationOptions;
import com.lineage.core.persistence.migration.MigrationResult;
import com.lineage.core.persistence.migration.MigrationRunner;
import com.lineage.core.persistence.migration.MigrationState;
import com.lineage.core.persistence.migration.SchemaInspector;
import com.lineage.core.persistence.migration.SchemaMigration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SQLite-backed store for agent execution history, timeline events,
 * conversations and messages.
 * <p>
 * {@link #initialize()} creates every table if absent and then runs the
 * pending schema migrations. Reads return {@link Optional#empty()} or empty
 * lists for missing records; failed writes raise {@link StorageException}
 * with a stable per-operation message.
 */
public class DurableTimelineStore {

    private static final Logger log = LoggerFactory.getLogger(DurableTimelineStore.class);

    private static final String END_TIME_KEY = "endTime";
    private static final String DEFAULT_USER = "default";
    private static final int DEFAULT_MESSAGE_PAGE = 100;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Logical table families, each with its own migration state. */
    public enum TableFamily { CONVERSATIONS, AGENT_HISTORY, TIMELINE_EVENTS }

    /** Migrations an operator can run or restore by name. */
    public enum MigrationTarget { CONVERSATIONS, AGENT_HISTORY }

    private final DataSource dataSource;
    private final StorageProperties properties;
    private final TableNames tables;
    private final JsonColumns json;
    private final TimelineEventRows eventRows;
    private final Clock clock;
    private final LineageMetrics metrics;
    private final MigrationFlagStore flags;
    private final MigrationRunner migrationRunner;
    private final ConversationSchemaMigration conversationMigration;
    private final AgentHistoryLogMigration historyMigration;
    private final Map<TableFamily, MigrationState> states =
            Collections.synchronizedMap(new EnumMap<>(TableFamily.class));

    public DurableTimelineStore(DataSource dataSource, StorageProperties properties) {
        this(dataSource, properties, Clock.systemUTC(), null);
    }

    public DurableTimelineStore(DataSource dataSource, StorageProperties properties,
                                Clock clock, LineageMetrics metrics) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.properties = Objects.requireNonNull(properties, "StorageProperties must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.metrics = metrics;
        this.tables = new TableNames(properties.getTablePrefix());
        this.json = new JsonColumns();
        this.eventRows = new TimelineEventRows(tables, json);
        this.flags = new MigrationFlagStore(tables, clock);
        this.migrationRunner = new MigrationRunner(dataSource, flags);
        this.conversationMigration = new ConversationSchemaMigration(tables, clock);
        this.historyMigration = new AgentHistoryLogMigration(tables, json,
                new LegacyEventTransformer(clock), clock);
        for (TableFamily family : TableFamily.values()) {
            states.put(family, MigrationState.UNINITIALIZED);
        }
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    /**
     * Creates tables, then runs pending migrations when enabled. A failed
     * migration is logged and leaves its family in {@link MigrationState#SCHEMA_CHECKED}.
     */
    public void initialize() {
        createTables();
        if (!properties.getMigration().isRunOnStartup()) {
            markReady(TableFamily.CONVERSATIONS);
            markReady(TableFamily.AGENT_HISTORY);
            return;
        }

        MigrationResult conversations = migrate(MigrationTarget.CONVERSATIONS, new MigrationOptions(true, true));
        if (!conversations.success()) {
            log.error("Conversation migration failed: {}", conversations.errorMessage());
        } else if (conversations.migratedCount() > 0) {
            log.info("{} conversation records migrated", conversations.migratedCount());
        }

        StorageProperties.Migration config = properties.getMigration();
        MigrationResult history = migrate(MigrationTarget.AGENT_HISTORY,
                new MigrationOptions(config.isCreateBackup(), config.isDeleteBackupAfterSuccess()));
        if (!history.success()) {
            log.error("Agent history migration failed: {} (backup available: {})",
                    history.errorMessage(), history.backupCreated());
        } else if (history.migratedCount() > 0) {
            log.info("{} agent history records migrated", history.migratedCount());
        }
    }

    /**
     * Creates every table and index if absent. Safe to call repeatedly.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection()) {
            SchemaInspector.execute(conn, TimelineSchema.createTable(tables.conversations(),
                    TimelineSchema.CONVERSATION_COLUMNS));
            SchemaInspector.execute(conn, TimelineSchema.createTable(tables.messages(),
                    TimelineSchema.MESSAGE_COLUMNS));
            SchemaInspector.execute(conn, TimelineSchema.createTable(tables.history(),
                    TimelineSchema.HISTORY_COLUMNS));
            SchemaInspector.execute(conn, TimelineSchema.createTable(tables.steps(),
                    TimelineSchema.STEP_COLUMNS));
            SchemaInspector.execute(conn, TimelineSchema.createTable(tables.events(),
                    TimelineSchema.EVENT_COLUMNS));
            flags.createTable(conn);

            List<String> indexes = new ArrayList<>();
            indexes.addAll(TimelineSchema.conversationIndexes(tables,
                    SchemaInspector.hasColumn(conn, tables.conversations(), "user_id")));
            indexes.addAll(TimelineSchema.messageIndexes(tables));
            indexes.addAll(TimelineSchema.historyIndexes(tables));
            indexes.addAll(TimelineSchema.stepIndexes(tables));
            indexes.addAll(TimelineSchema.eventIndexes(tables));
            for (String index : indexes) {
                SchemaInspector.execute(conn, index);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to create tables", e);
        }
        for (TableFamily family : TableFamily.values()) {
            states.put(family, MigrationState.SCHEMA_CHECKED);
        }
        markReady(TableFamily.TIMELINE_EVENTS);
        debug("Tables ensured with prefix '{}'", tables.prefix());
    }

    public MigrationResult migrate(MigrationTarget target, MigrationOptions options) {
        TableFamily family = familyOf(target);
        states.put(family, MigrationState.MIGRATING);
        MigrationResult result = migrationRunner.run(migrationFor(target), options);
        states.put(family, result.success() ? MigrationState.READY : MigrationState.SCHEMA_CHECKED);
        if (metrics != null) {
            metrics.recordMigrationResult(migrationFor(target).type(), result.success());
        }
        return result;
    }

    /**
     * Replaces the target's live tables with their backups and clears its
     * migration flag. Fails when no backup exists.
     */
    public MigrationResult restoreFromBackup(MigrationTarget target) {
        MigrationResult result = migrationRunner.restoreFromBackup(migrationFor(target));
        if (result.success()) {
            states.put(familyOf(target), MigrationState.SCHEMA_CHECKED);
        }
        return result;
    }

    public boolean hasBackup(MigrationTarget target) {
        return migrationRunner.backupExists(migrationFor(target));
    }

    public List<MigrationFlag> getMigrationFlags() {
        try (Connection conn = dataSource.getConnection()) {
            flags.createTable(conn);
            return flags.list(conn);
        } catch (SQLException e) {
            throw new StorageException("Failed to read migration flags", e);
        }
    }

    public MigrationState getMigrationState(TableFamily family) {
        return states.get(family);
    }

    public boolean isReady() {
        return states.values().stream().allMatch(state -> state == MigrationState.READY);
    }

    public TableNames tableNames() {
        return tables;
    }

    // ── Agent history ────────────────────────────────────────────────────

    /**
     * Inserts or replaces the entry's own row. Steps and events are written
     * through {@link #addHistoryStep} and {@link #addTimelineEvent}.
     */
    public void addHistoryEntry(ExecutionEntry entry) {
        String sql = """
                INSERT OR REPLACE INTO %s (id, agent_id, timestamp, status, input, output, usage, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(tables.history());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bindEntry(stmt, entry);
            stmt.executeUpdate();
            debug("Stored history entry {} for agent {}", entry.id(), entry.agentId());
        } catch (SQLException e) {
            throw new StorageException("Failed to add history entry", e);
        }
    }

    /**
     * Rewrites an existing entry's row.
     *
     * @throws RecordNotFoundException if no entry has this id
     */
    public void updateHistoryEntry(ExecutionEntry entry) {
        String sql = """
                UPDATE %s SET agent_id = ?, timestamp = ?, status = ?, input = ?, output = ?,
                              usage = ?, metadata = ?
                WHERE id = ?
                """.formatted(tables.history());
        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, entry.agentId());
            stmt.setString(2, Timestamps.format(entry.startTime() != null ? entry.startTime() : clock.instant()));
            stmt.setString(3, entry.status() == null ? null : entry.status().value());
            stmt.setString(4, json.write(entry.input()));
            stmt.setString(5, json.write(entry.output()));
            stmt.setString(6, json.write(entry.usage()));
            stmt.setString(7, json.write(metadataWithEndTime(entry)));
            stmt.setString(8, entry.id());
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to update history entry", e);
        }
        if (updated == 0) {
            throw new RecordNotFoundException("History entry", entry.id());
        }
        debug("Updated history entry {} (status={})", entry.id(), entry.status());
    }

    public void addHistoryStep(HistoryStep step, String historyId, String agentId) {
        String sql = """
                INSERT OR REPLACE INTO %s (key, value, history_id, agent_id)
                VALUES (?, ?, ?, ?)
                """.formatted(tables.steps());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, step.id());
            stmt.setString(2, json.write(step));
            stmt.setString(3, historyId);
            stmt.setString(4, agentId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to add history step", e);
        }
    }

    public Optional<HistoryStep> getHistoryStep(String key) {
        String sql = "SELECT value FROM %s WHERE key = ?".formatted(tables.steps());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(json.read(rs.getString("value"), HistoryStep.class));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to get history step", e);
        }
        return Optional.empty();
    }

    public void addTimelineEvent(TimelineEvent event, String historyId, String agentId) {
        try (Connection conn = dataSource.getConnection()) {
            eventRows.upsert(conn, event, historyId, agentId);
            debug("Stored timeline event {} ({}) for entry {}", event.id(), event.name(), historyId);
        } catch (SQLException e) {
            throw new StorageException("Failed to add timeline event", e);
        }
    }

    /**
     * Events one agent recorded under a history id, in start order.
     */
    public List<TimelineEvent> getTimelineEvents(String historyId, String agentId) {
        try (Connection conn = dataSource.getConnection()) {
            return loadEvents(conn, historyId, agentId);
        } catch (SQLException e) {
            throw new StorageException("Failed to get timeline events", e);
        }
    }

    /**
     * Point lookup with steps and events joined.
     */
    public Optional<ExecutionEntry> getHistoryEntry(String id) {
        String sql = "SELECT * FROM %s WHERE id = ?".formatted(tables.history());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                ExecutionEntry entry = mapEntry(rs);
                return Optional.of(withChildren(conn, entry));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to get history entry", e);
        }
    }

    /**
     * Every entry of one agent, oldest first, with steps and events joined.
     */
    public List<ExecutionEntry> getAllHistoryEntriesByAgent(String agentId) {
        String sql = "SELECT * FROM %s WHERE agent_id = ? ORDER BY timestamp ASC, rowid ASC"
                .formatted(tables.history());
        List<ExecutionEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapEntry(rs));
                }
            }
            List<ExecutionEntry> joined = new ArrayList<>(entries.size());
            for (ExecutionEntry entry : entries) {
                joined.add(withChildren(conn, entry));
            }
            return joined;
        } catch (SQLException e) {
            throw new StorageException("Failed to get agent history", e);
        }
    }

    /**
     * Deletes every entry, step and event of one agent.
     *
     * @return the number of entries deleted
     */
    public int clearHistory(String agentId) {
        try (Connection conn = dataSource.getConnection()) {
            return inTransaction(conn, () -> {
                deleteByAgent(conn, tables.events(), agentId);
                deleteByAgent(conn, tables.steps(), agentId);
                int deleted = deleteByAgent(conn, tables.history(), agentId);
                debug("Cleared {} history entries for agent {}", deleted, agentId);
                return deleted;
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to clear history", e);
        }
    }

    // ── Conversations ────────────────────────────────────────────────────

    public Conversation createConversation(Conversation conversation) {
        Instant now = clock.instant();
        Conversation stored = new Conversation(
                conversation.id(),
                conversation.resourceId(),
                conversation.userId() != null ? conversation.userId() : DEFAULT_USER,
                conversation.title(),
                conversation.metadata(),
                conversation.createdAt() != null ? conversation.createdAt() : now,
                conversation.updatedAt() != null ? conversation.updatedAt() : now);
        String sql = """
                INSERT INTO %s (id, resource_id, user_id, title, metadata, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """.formatted(tables.conversations());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, stored.id());
            stmt.setString(2, stored.resourceId());
            stmt.setString(3, stored.userId());
            stmt.setString(4, stored.title());
            stmt.setString(5, json.write(stored.metadata()));
            stmt.setString(6, Timestamps.format(stored.createdAt()));
            stmt.setString(7, Timestamps.format(stored.updatedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to create conversation", e);
        }
        debug("Created conversation {} for user {}", stored.id(), stored.userId());
        return stored;
    }

    public Optional<Conversation> getConversation(String id) {
        String sql = "SELECT * FROM %s WHERE id = ?".formatted(tables.conversations());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapConversation(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to get conversation", e);
        }
    }

    /**
     * Fetches a conversation only if {@code userId} owns it. Another user's
     * conversation is reported as absent.
     */
    public Optional<Conversation> getUserConversation(String conversationId, String userId) {
        return getConversation(conversationId).filter(c -> Objects.equals(c.userId(), userId));
    }

    public List<Conversation> getConversations(String resourceId) {
        return queryConversations(ConversationQuery.all().forResource(resourceId).page(Integer.MAX_VALUE, 0));
    }

    public List<Conversation> getConversationsByUserId(String userId, ConversationQuery query) {
        return queryConversations(query.forUser(userId));
    }

    public List<Conversation> queryConversations(ConversationQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tables.conversations());
        List<String> args = new ArrayList<>();
        List<String> where = new ArrayList<>();
        if (query.userId() != null) {
            where.add("user_id = ?");
            args.add(query.userId());
        }
        if (query.resourceId() != null) {
            where.add("resource_id = ?");
            args.add(query.resourceId());
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        sql.append(" ORDER BY ").append(query.orderBy().column()).append(' ').append(query.direction().name())
                .append(", id ").append(query.direction().name())
                .append(" LIMIT ? OFFSET ?");

        List<Conversation> conversations = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int i = 1;
            for (String arg : args) {
                stmt.setString(i++, arg);
            }
            stmt.setInt(i++, query.limit());
            stmt.setInt(i, query.offset());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    conversations.add(mapConversation(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query conversations", e);
        }
        return conversations;
    }

    /**
     * Most recently updated first.
     *
     * @param page     1-based page number
     * @param pageSize conversations per page
     */
    public ConversationPage getPaginatedUserConversations(String userId, int page, int pageSize) {
        int safePage = Math.max(1, page);
        int safeSize = Math.max(1, pageSize);
        List<Conversation> rows = queryConversations(ConversationQuery.all()
                .forUser(userId)
                .page(safeSize + 1, (safePage - 1) * safeSize));
        boolean hasMore = rows.size() > safeSize;
        List<Conversation> pageRows = hasMore ? rows.subList(0, safeSize) : rows;
        return new ConversationPage(List.copyOf(pageRows), safePage, safeSize, hasMore);
    }

    /**
     * Applies a partial update and bumps {@code updated_at}.
     *
     * @throws RecordNotFoundException if the conversation does not exist
     */
    public Conversation updateConversation(String id, ConversationUpdate update) {
        List<String> sets = new ArrayList<>();
        List<String> args = new ArrayList<>();
        if (update.title() != null) {
            sets.add("title = ?");
            args.add(update.title());
        }
        if (update.resourceId() != null) {
            sets.add("resource_id = ?");
            args.add(update.resourceId());
        }
        if (update.metadata() != null) {
            sets.add("metadata = ?");
            try {
                args.add(json.write(update.metadata()));
            } catch (SQLException e) {
                throw new StorageException("Failed to update conversation", e);
            }
        }
        sets.add("updated_at = ?");
        args.add(Timestamps.format(clock.instant()));

        String sql = "UPDATE %s SET %s WHERE id = ?".formatted(tables.conversations(), String.join(", ", sets));
        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            int i = 1;
            for (String arg : args) {
                stmt.setString(i++, arg);
            }
            stmt.setString(i, id);
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to update conversation", e);
        }
        if (updated == 0) {
            throw new RecordNotFoundException("Conversation", id);
        }
        return getConversation(id).orElseThrow(() -> new RecordNotFoundException("Conversation", id));
    }

    /**
     * Deletes a conversation and its messages. Deleting an absent conversation is a no-op.
     */
    public void deleteConversation(String id) {
        try (Connection conn = dataSource.getConnection()) {
            inTransaction(conn, () -> {
                try (PreparedStatement messages = conn.prepareStatement(
                        "DELETE FROM %s WHERE conversation_id = ?".formatted(tables.messages()));
                     PreparedStatement conversation = conn.prepareStatement(
                             "DELETE FROM %s WHERE id = ?".formatted(tables.conversations()))) {
                    messages.setString(1, id);
                    messages.executeUpdate();
                    conversation.setString(1, id);
                    conversation.executeUpdate();
                }
                return null;
            });
            debug("Deleted conversation {}", id);
        } catch (SQLException e) {
            throw new StorageException("Failed to delete conversation", e);
        }
    }

    // ── Messages ─────────────────────────────────────────────────────────

    /**
     * Appends a message, then prunes the conversation down to the storage
     * limit, oldest first. Pruning failures are logged, not raised.
     */
    public void addMessage(String conversationId, ConversationMessage message) {
        String sql = """
                INSERT INTO %s (conversation_id, message_id, role, content, type, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """.formatted(tables.messages());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, conversationId);
            stmt.setString(2, message.id());
            stmt.setString(3, message.role());
            stmt.setString(4, message.content());
            stmt.setString(5, message.type() != null ? message.type() : "text");
            stmt.setString(6, Timestamps.format(message.createdAt() != null ? message.createdAt() : clock.instant()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to add message", e);
        }
        pruneOldMessages(conversationId);
    }

    public List<ConversationMessage> getMessages(MessageFilter filter) {
        boolean scopedToUser = filter.userId() != null && !DEFAULT_USER.equals(filter.userId());
        StringBuilder sql = new StringBuilder("SELECT m.* FROM ").append(tables.messages()).append(" m");
        List<String> where = new ArrayList<>();
        List<String> args = new ArrayList<>();
        if (scopedToUser) {
            sql.append(" JOIN ").append(tables.conversations()).append(" c ON c.id = m.conversation_id");
            where.add("c.user_id = ?");
            args.add(filter.userId());
        }
        if (filter.conversationId() != null) {
            where.add("m.conversation_id = ?");
            args.add(filter.conversationId());
        }
        if (filter.before() != null) {
            where.add("m.created_at < ?");
            args.add(Timestamps.format(filter.before()));
        }
        if (filter.after() != null) {
            where.add("m.created_at > ?");
            args.add(Timestamps.format(filter.after()));
        }
        if (filter.role() != null) {
            where.add("m.role = ?");
            args.add(filter.role());
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        sql.append(" ORDER BY m.created_at DESC, m.rowid DESC");
        if (filter.limit() != null && filter.limit() > 0) {
            sql.append(" LIMIT ").append(filter.limit().intValue());
        }

        List<ConversationMessage> messages = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                stmt.setString(i + 1, args.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    messages.add(mapMessage(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to get messages", e);
        }
        Collections.reverse(messages);
        return messages;
    }

    public List<ConversationMessage> getConversationMessages(String conversationId, int limit, int offset) {
        String sql = """
                SELECT * FROM %s WHERE conversation_id = ?
                ORDER BY created_at ASC, rowid ASC
                LIMIT ? OFFSET ?
                """.formatted(tables.messages());
        List<ConversationMessage> messages = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, conversationId);
            stmt.setInt(2, limit > 0 ? limit : DEFAULT_MESSAGE_PAGE);
            stmt.setInt(3, Math.max(0, offset));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    messages.add(mapMessage(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to get conversation messages", e);
        }
        return messages;
    }

    /**
     * Deletes messages in the user's conversations, or in one of them when
     * {@code conversationId} is given. Conversations of other users are untouched.
     */
    public int clearMessages(String userId, String conversationId) {
        String ownedBy = "SELECT id FROM %s WHERE user_id = ?".formatted(tables.conversations());
        String sql = conversationId != null
                ? "DELETE FROM %s WHERE conversation_id = ? AND conversation_id IN (%s)"
                        .formatted(tables.messages(), ownedBy)
                : "DELETE FROM %s WHERE conversation_id IN (%s)".formatted(tables.messages(), ownedBy);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (conversationId != null) {
                stmt.setString(1, conversationId);
                stmt.setString(2, userId);
            } else {
                stmt.setString(1, userId);
            }
            int deleted = stmt.executeUpdate();
            debug("Cleared {} messages for user {}", deleted, userId);
            return deleted;
        } catch (SQLException e) {
            throw new StorageException("Failed to clear messages", e);
        }
    }

    private void pruneOldMessages(String conversationId) {
        int limit = properties.getStorageLimit();
        if (limit <= 0) {
            return;
        }
        String count = "SELECT COUNT(*) FROM %s WHERE conversation_id = ?".formatted(tables.messages());
        String delete = """
                DELETE FROM %1$s WHERE conversation_id = ? AND message_id IN (
                    SELECT message_id FROM %1$s WHERE conversation_id = ?
                    ORDER BY created_at ASC, rowid ASC
                    LIMIT ?
                )
                """.formatted(tables.messages());
        try (Connection conn = dataSource.getConnection()) {
            int total;
            try (PreparedStatement stmt = conn.prepareStatement(count)) {
                stmt.setString(1, conversationId);
                try (ResultSet rs = stmt.executeQuery()) {
                    total = rs.next() ? rs.getInt(1) : 0;
                }
            }
            if (total <= limit) {
                return;
            }
            try (PreparedStatement stmt = conn.prepareStatement(delete)) {
                stmt.setString(1, conversationId);
                stmt.setString(2, conversationId);
                stmt.setInt(3, total - limit);
                int pruned = stmt.executeUpdate();
                debug("Pruned {} old messages from conversation {}", pruned, conversationId);
            }
        } catch (SQLException e) {
            log.warn("Failed to prune messages for conversation {}: {}", conversationId, e.getMessage());
        }
    }

    // ── Row mapping ──────────────────────────────────────────────────────

    private void bindEntry(PreparedStatement stmt, ExecutionEntry entry) throws SQLException {
        stmt.setString(1, entry.id());
        stmt.setString(2, entry.agentId());
        stmt.setString(3, Timestamps.format(entry.startTime() != null ? entry.startTime() : clock.instant()));
        stmt.setString(4, entry.status() == null ? null : entry.status().value());
        stmt.setString(5, json.write(entry.input()));
        stmt.setString(6, json.write(entry.output()));
        stmt.setString(7, json.write(entry.usage()));
        stmt.setString(8, json.write(metadataWithEndTime(entry)));
    }

    // The table has no end-time column; the end time travels in the metadata blob.
    private Map<String, Object> metadataWithEndTime(ExecutionEntry entry) {
        if (entry.endTime() == null) {
            return entry.metadata().isEmpty() ? null : entry.metadata();
        }
        Map<String, Object> metadata = new LinkedHashMap<>(entry.metadata());
        metadata.put(END_TIME_KEY, Timestamps.format(entry.endTime()));
        return metadata;
    }

    private ExecutionEntry mapEntry(ResultSet rs) throws SQLException {
        Map<String, Object> metadata = json.read(rs.getString("metadata"), MAP_TYPE);
        Instant endTime = null;
        if (metadata != null && metadata.get(END_TIME_KEY) instanceof String end) {
            metadata = new LinkedHashMap<>(metadata);
            metadata.remove(END_TIME_KEY);
            endTime = Timestamps.parseOr(end, null);
        }
        String status = rs.getString("status");
        return new ExecutionEntry(
                rs.getString("id"),
                rs.getString("agent_id"),
                Timestamps.parseOr(rs.getString("timestamp"), null),
                endTime,
                parseStatus(status),
                json.readValue(rs.getString("input")),
                json.readValue(rs.getString("output")),
                json.read(rs.getString("usage"), MAP_TYPE),
                List.of(),
                List.of(),
                metadata);
    }

    private static AgentStatus parseStatus(String status) {
        if (status == null) {
            return null;
        }
        try {
            return AgentStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            log.debug("Unknown stored status '{}', treating as idle", status);
            return AgentStatus.IDLE;
        }
    }

    private ExecutionEntry withChildren(Connection conn, ExecutionEntry entry) throws SQLException {
        List<HistoryStep> steps = new ArrayList<>();
        String stepSql = "SELECT value FROM %s WHERE history_id = ? AND agent_id = ? ORDER BY rowid"
                .formatted(tables.steps());
        try (PreparedStatement stmt = conn.prepareStatement(stepSql)) {
            stmt.setString(1, entry.id());
            stmt.setString(2, entry.agentId());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    HistoryStep step = json.read(rs.getString("value"), HistoryStep.class);
                    if (step != null) {
                        steps.add(step);
                    }
                }
            }
        }

        return entry.withSteps(steps).withEvents(loadEvents(conn, entry.id(), entry.agentId()));
    }

    private List<TimelineEvent> loadEvents(Connection conn, String historyId, String agentId) throws SQLException {
        List<TimelineEvent> events = new ArrayList<>();
        String sql = """
                SELECT * FROM %s WHERE history_id = ? AND agent_id = ?
                ORDER BY start_time ASC, rowid ASC
                """.formatted(tables.events());
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, historyId);
            stmt.setString(2, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(eventRows.map(rs));
                }
            }
        }
        return events;
    }

    private Conversation mapConversation(ResultSet rs) throws SQLException {
        return new Conversation(
                rs.getString("id"),
                rs.getString("resource_id"),
                rs.getString("user_id"),
                rs.getString("title"),
                json.read(rs.getString("metadata"), MAP_TYPE),
                Timestamps.parseOr(rs.getString("created_at"), null),
                Timestamps.parseOr(rs.getString("updated_at"), null));
    }

    private static ConversationMessage mapMessage(ResultSet rs) throws SQLException {
        return new ConversationMessage(
                rs.getString("message_id"),
                rs.getString("role"),
                rs.getString("content"),
                rs.getString("type"),
                Timestamps.parseOr(rs.getString("created_at"), null));
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private int deleteByAgent(Connection conn, String table, String agentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM %s WHERE agent_id = ?".formatted(table))) {
            stmt.setString(1, agentId);
            return stmt.executeUpdate();
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    private static <T> T inTransaction(Connection conn, SqlWork<T> work) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            T result = work.run();
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private SchemaMigration migrationFor(MigrationTarget target) {
        return switch (target) {
            case CONVERSATIONS -> conversationMigration;
            case AGENT_HISTORY -> historyMigration;
        };
    }

    private static TableFamily familyOf(MigrationTarget target) {
        return switch (target) {
            case CONVERSATIONS -> TableFamily.CONVERSATIONS;
            case AGENT_HISTORY -> TableFamily.AGENT_HISTORY;
        };
    }

    private void markReady(TableFamily family) {
        states.put(family, MigrationState.READY);
    }

    private void debug(String message, Object... args) {
        if (properties.isDebug()) {
            log.info(message, args);
        } else {
            log.debug(message, args);
        }
    }
}

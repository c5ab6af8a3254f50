package de.bsommerfeld.scratchdb.db.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.domain.AgentSettings;
import de.bsommerfeld.scratchdb.core.domain.Skill;
import de.bsommerfeld.scratchdb.core.domain.TaskCard;
import de.bsommerfeld.scratchdb.core.domain.TaskStatus;
import de.bsommerfeld.scratchdb.core.util.StorageUtils;
import de.bsommerfeld.scratchdb.db.SqlLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link RecordStore} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation (or per transaction) and
 * closed immediately after. SQLite serializes writes at the file level, and
 * one processing cycle applies its mirrors sequentially.
 *
 * <h3>Stored shapes</h3>
 * Timestamps are epoch milliseconds. Skill tool lists are JSON arrays of
 * strings.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlRecordStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final String dbUrl;

    @Inject
    public SqlRecordStore() {
        this(StorageUtils.getAppDataDir("scratchdb").resolve("records.db"));
    }

    public SqlRecordStore(Path dbFile) {
        Path parent = dbFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            LOG.error("Failed to create record store directory {}", parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing record store at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new RecordStoreException("Record store initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, one statement at a time, in a
     * single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(false);
            for (String sql : SqlLoader.script("schema.sql"))
                stmt.execute(sql);
            conn.commit();
            LOG.info("Record store schema applied.");
        } catch (IllegalStateException | SQLException e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public List<TaskCard> findVisibleCards(String scopeId) {
        return queryCards("select-visible-cards", scopeId);
    }

    @Override
    public List<TaskCard> findAssignedCards(String agentId) {
        return queryCards("select-assigned-cards", agentId);
    }

    private List<TaskCard> queryCards(String sqlName, String key) {
        List<TaskCard> cards = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    cards.add(mapCard(rs));
            }
        } catch (SQLException e) {
            throw new RecordStoreException("Failed to load task cards for " + key, e);
        }
        return cards;
    }

    @Override
    public List<Skill> findSkills(String agentId) {
        List<Skill> skills = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-skills"))) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    skills.add(mapSkill(rs));
            }
        } catch (SQLException e) {
            throw new RecordStoreException("Failed to load skills for agent " + agentId, e);
        }
        return skills;
    }

    @Override
    public AgentSettings findSettings(String agentId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-settings"))) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return new AgentSettings(rs.getString("charter"), rs.getString("schedule"));
            }
        } catch (SQLException e) {
            throw new RecordStoreException("Failed to load settings for agent " + agentId, e);
        }
        return AgentSettings.empty();
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(new SqlTransaction(conn));
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RecordStoreException("Record store transaction failed", e);
        }
    }

    /** Transaction view bound to one open connection with auto-commit off. */
    private static final class SqlTransaction implements RecordTransaction {

        private final Connection conn;

        SqlTransaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public Optional<TaskCard> findOwnedCard(String agentId, String cardId) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-owned-card"))) {
                ps.setString(1, cardId);
                ps.setString(2, agentId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapCard(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to load card " + cardId, e);
            }
        }

        @Override
        public void insertCard(String scopeId, TaskCard card) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-card"))) {
                ps.setString(1, card.id());
                ps.setString(2, scopeId);
                ps.setString(3, card.assignedAgentId());
                ps.setString(4, card.title());
                ps.setString(5, nullToEmpty(card.description()));
                ps.setString(6, card.status().value());
                ps.setInt(7, card.priority());
                ps.setLong(8, card.createdAt().toEpochMilli());
                ps.setLong(9, card.updatedAt().toEpochMilli());
                setInstant(ps, 10, card.completedAt());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to insert card " + card.id(), e);
            }
        }

        @Override
        public boolean updateCard(TaskCard card) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-card"))) {
                ps.setString(1, card.title());
                ps.setString(2, nullToEmpty(card.description()));
                ps.setString(3, card.status().value());
                ps.setInt(4, card.priority());
                ps.setLong(5, card.updatedAt().toEpochMilli());
                setInstant(ps, 6, card.completedAt());
                ps.setString(7, card.id());
                ps.setString(8, card.assignedAgentId());
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to update card " + card.id(), e);
            }
        }

        @Override
        public boolean deleteCard(String agentId, String cardId) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-card"))) {
                ps.setString(1, cardId);
                ps.setString(2, agentId);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to delete card " + cardId, e);
            }
        }

        @Override
        public Optional<Skill> findLatestSkill(String agentId, String name) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-latest-skill"))) {
                ps.setString(1, agentId);
                ps.setString(2, name);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapSkill(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to load skill " + name, e);
            }
        }

        @Override
        public void insertSkill(Skill skill) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-skill"))) {
                ps.setString(1, skill.id());
                ps.setString(2, skill.agentId());
                ps.setString(3, skill.name());
                ps.setString(4, nullToEmpty(skill.description()));
                ps.setInt(5, skill.version());
                ps.setString(6, writeTools(skill.tools()));
                ps.setString(7, nullToEmpty(skill.instructions()));
                ps.setLong(8, skill.createdAt().toEpochMilli());
                ps.setLong(9, skill.updatedAt().toEpochMilli());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to insert skill " + skill.name() + "@" + skill.version(), e);
            }
        }

        @Override
        public int deleteSkills(String agentId, String name) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-skills"))) {
                ps.setString(1, agentId);
                ps.setString(2, name);
                return ps.executeUpdate();
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to delete skill " + name, e);
            }
        }

        @Override
        public void saveSettings(String agentId, AgentSettings settings) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-settings"))) {
                ps.setString(1, agentId);
                ps.setString(2, nullToEmpty(settings.charter()));
                ps.setString(3, settings.schedule());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new RecordStoreException("Failed to save settings for agent " + agentId, e);
            }
        }
    }

    // =====================================================================
    // ResultSet -> Domain Mapping
    // =====================================================================

    private static TaskCard mapCard(ResultSet rs) throws SQLException {
        String rawStatus = rs.getString("status");
        TaskStatus status = TaskStatus.parse(rawStatus)
                .orElseThrow(() -> new SQLException("Unknown card status: " + rawStatus));
        return new TaskCard(
                rs.getString("id"), rs.getString("title"),
                rs.getString("description"), status,
                rs.getInt("priority"), rs.getString("assigned_agent_id"),
                getInstant(rs, "created_at"), getInstant(rs, "updated_at"),
                getInstant(rs, "completed_at"));
    }

    private static Skill mapSkill(ResultSet rs) throws SQLException {
        return new Skill(
                rs.getString("id"), rs.getString("agent_id"),
                rs.getString("name"), rs.getString("description"),
                rs.getInt("version"), readTools(rs.getString("tools")),
                rs.getString("instructions"),
                getInstant(rs, "created_at"), getInstant(rs, "updated_at"));
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String writeTools(List<String> tools) {
        try {
            return MAPPER.writeValueAsString(tools);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Failed to serialize skill tools", e);
        }
    }

    /** Stored tool lists are written by this class; anything unreadable maps to an empty list. */
    private static List<String> readTools(String json) {
        if (json == null || json.isBlank())
            return List.of();
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            LOG.warn("Unreadable skill tools column '{}'", json, e);
            return List.of();
        }
    }
}

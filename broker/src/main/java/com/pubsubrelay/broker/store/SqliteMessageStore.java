package com.pubsubrelay.broker.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed store: one database file and one JDBC connection per broker instance.
 * <p>
 * Writes go through a single connection guarded by the store monitor, so concurrent
 * {@link #createChannel} calls for the same name collapse onto {@code INSERT OR IGNORE}. The database
 * runs in WAL mode; {@link #close()} checkpoints the WAL into the main file before releasing it.
 * </p>
 */
public class SqliteMessageStore extends AbstractMessageStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteMessageStore.class);

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS messages ("
            + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " channel TEXT NOT NULL,"
            + " type TEXT NOT NULL,"
            + " payload TEXT NOT NULL,"
            + " sender_id TEXT NOT NULL,"
            + " ts INTEGER NOT NULL,"
            + " sender_metadata TEXT,"
            + " attachment BLOB"
            + ")",
        "CREATE INDEX IF NOT EXISTS idx_messages_channel_id ON messages(channel, id)",
        "CREATE TABLE IF NOT EXISTS channels ("
            + " channel TEXT PRIMARY KEY,"
            + " context_id TEXT,"
            + " created_at INTEGER NOT NULL,"
            + " created_by TEXT NOT NULL"
            + ")"
    };

    private static final String SELECT_COLUMNS =
        "SELECT id, channel, type, payload, sender_id, ts, sender_metadata, attachment FROM messages";

    private final Path dbPath;
    private Connection connection;

    public SqliteMessageStore(Path dbPath) {
        this.dbPath = dbPath;
    }

    @Override
    public synchronized void init() {
        ensureOpen();
        try {
            if (connection == null) {
                Path parent = dbPath.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
                try (Statement statement = connection.createStatement()) {
                    statement.execute("PRAGMA journal_mode = WAL");
                }
                log.info("Opened message store at {}", dbPath);
            }

            try (Statement statement = connection.createStatement()) {
                for (String ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
            migrateSenderMetadata();
        } catch (SQLException | IOException e) {
            throw new PersistenceException("Failed to initialize message store at " + dbPath, e);
        }
    }

    /**
     * Databases written before sender metadata snapshots existed lack the column.
     */
    private void migrateSenderMetadata() throws SQLException {
        boolean present = false;
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("PRAGMA table_info(messages)")) {
            while (rs.next()) {
                if ("sender_metadata".equals(rs.getString("name"))) {
                    present = true;
                }
            }
        }
        if (!present) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("ALTER TABLE messages ADD COLUMN sender_metadata TEXT");
            }
            log.info("Added sender_metadata column to messages table");
        }
    }

    @Override
    public synchronized void createChannel(String channel, String contextId, String createdBy) {
        Connection conn = requireConnection();
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT OR IGNORE INTO channels (channel, context_id, created_at, created_by) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, channel);
            ps.setString(2, contextId);
            ps.setLong(3, System.currentTimeMillis());
            ps.setString(4, createdBy);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to create channel " + channel, e);
        }
    }

    @Override
    public synchronized Optional<ChannelInfo> getChannel(String channel) {
        Connection conn = requireConnection();
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT context_id, created_at, created_by FROM channels WHERE channel = ?")) {
            ps.setString(1, channel);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ChannelInfo(
                    rs.getString("context_id"),
                    rs.getLong("created_at"),
                    rs.getString("created_by")
                ));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read channel " + channel, e);
        }
    }

    @Override
    public synchronized long insert(String channel, String type, String payload, String senderId, long ts,
                                    ObjectNode senderMetadata, byte[] attachment) {
        Connection conn = requireConnection();
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT INTO messages (channel, type, payload, sender_id, ts, sender_metadata, attachment)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, channel);
            ps.setString(2, type);
            ps.setString(3, payload);
            ps.setString(4, senderId);
            ps.setLong(5, ts);
            ps.setString(6, serializeMetadata(senderMetadata));
            ps.setBytes(7, attachment);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to insert message into " + channel, e);
        }

        try (Statement statement = conn.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read assigned message id", e);
        }
    }

    @Override
    public synchronized List<MessageRow> query(String channel, long sinceId) {
        Connection conn = requireConnection();
        try (PreparedStatement ps = conn.prepareStatement(
            SELECT_COLUMNS + " WHERE channel = ? AND id > ? ORDER BY id ASC")) {
            ps.setString(1, channel);
            ps.setLong(2, sinceId);
            return readRows(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to query " + channel, e);
        }
    }

    @Override
    protected synchronized List<MessageRow> doQueryByType(String channel, Set<String> types, long sinceId) {
        Connection conn = requireConnection();
        String placeholders = String.join(", ", Collections.nCopies(types.size(), "?"));
        try (PreparedStatement ps = conn.prepareStatement(
            SELECT_COLUMNS + " WHERE channel = ? AND id > ? AND type IN (" + placeholders + ") ORDER BY id ASC")) {
            ps.setString(1, channel);
            ps.setLong(2, sinceId);
            int index = 3;
            for (String type : types) {
                ps.setString(index++, type);
            }
            return readRows(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to query " + channel + " by type", e);
        }
    }

    private List<MessageRow> readRows(PreparedStatement ps) throws SQLException {
        List<MessageRow> rows = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                rows.add(MessageRow.builder()
                    .id(rs.getLong("id"))
                    .channel(rs.getString("channel"))
                    .type(rs.getString("type"))
                    .payload(rs.getString("payload"))
                    .senderId(rs.getString("sender_id"))
                    .ts(rs.getLong("ts"))
                    .senderMetadata(rs.getString("sender_metadata"))
                    .attachment(rs.getBytes("attachment"))
                    .build());
            }
        }
        return rows;
    }

    @Override
    public synchronized void close() {
        if (!markClosed() || connection == null) {
            return;
        }

        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA synchronous = FULL");
            try (ResultSet ignored = statement.executeQuery("PRAGMA wal_checkpoint(TRUNCATE)")) {
                log.debug("WAL checkpoint completed for {}", dbPath);
            }
        } catch (SQLException e) {
            log.warn("WAL checkpoint failed for {}: {}", dbPath, e.getMessage());
        }

        try {
            connection.close();
            log.info("Closed message store at {}", dbPath);
        } catch (SQLException e) {
            log.warn("Failed to close message store at {}", dbPath, e);
        } finally {
            connection = null;
        }
    }

    private Connection requireConnection() {
        ensureOpen();
        if (connection == null) {
            throw new PersistenceException("Store not initialized");
        }
        return connection;
    }
}

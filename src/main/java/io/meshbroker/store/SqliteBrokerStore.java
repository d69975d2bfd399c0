package io.meshbroker.store;

import io.meshbroker.config.BrokerConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link BrokerStore} on a single SQLite table. Each list is ordered by a signed
 * {@code pos} column: appends take {@code max(pos) + 1}, head inserts {@code min(pos) - 1}.
 * Writers are serialized on this instance, which is the only writer of the file.
 */
public final class SqliteBrokerStore implements BrokerStore {
    private final BrokerConfig config;
    private final String jdbcUrl;

    public SqliteBrokerStore(BrokerConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    @Override
    public void init() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new StoreException("Failed to create data root: " + config.rootDir(), e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS list_entries (
                        list_key TEXT NOT NULL,
                        pos INTEGER NOT NULL,
                        value TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(list_key, pos)
                    )
                    """);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema: " + config.dbFile(), e);
        }
    }

    Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    @Override
    public synchronized void append(String key, String value) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                long pos = edgePos(c, key, "MAX(pos)", -1L) + 1L;
                insert(c, key, pos, value);
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to append to " + key, e);
        }
    }

    @Override
    public synchronized void pushFront(String key, String value, int maxLength) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                long pos = edgePos(c, key, "MIN(pos)", 1L) - 1L;
                insert(c, key, pos, value);
                if (maxLength > 0) {
                    try (PreparedStatement trim = c.prepareStatement("""
                            DELETE FROM list_entries
                            WHERE list_key = ? AND pos NOT IN (
                                SELECT pos FROM list_entries WHERE list_key = ? ORDER BY pos ASC LIMIT ?
                            )
                            """)) {
                        trim.setString(1, key);
                        trim.setString(2, key);
                        trim.setInt(3, maxLength);
                        trim.executeUpdate();
                    }
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to push to " + key, e);
        }
    }

    @Override
    public List<String> range(String key, int limit) {
        String sql = limit > 0
                ? "SELECT value FROM list_entries WHERE list_key = ? ORDER BY pos ASC LIMIT ?"
                : "SELECT value FROM list_entries WHERE list_key = ? ORDER BY pos ASC";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            if (limit > 0) {
                ps.setInt(2, limit);
            }
            return readValues(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to read " + key, e);
        }
    }

    @Override
    public synchronized List<String> readAll(String key, boolean clear) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                List<String> out;
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT value FROM list_entries WHERE list_key = ? ORDER BY pos ASC")) {
                    ps.setString(1, key);
                    out = readValues(ps);
                }
                if (clear) {
                    try (PreparedStatement del = c.prepareStatement("DELETE FROM list_entries WHERE list_key = ?")) {
                        del.setString(1, key);
                        del.executeUpdate();
                    }
                }
                c.commit();
                return out;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read all of " + key, e);
        }
    }

    @Override
    public long size(String key) {
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM list_entries WHERE list_key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count " + key, e);
        }
    }

    @Override
    public Set<String> keys(String prefix) {
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT DISTINCT list_key FROM list_entries WHERE substr(list_key, 1, ?) = ?")) {
            ps.setInt(1, prefix.length());
            ps.setString(2, prefix);
            Set<String> out = new TreeSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list keys with prefix " + prefix, e);
        }
    }

    @Override
    public void close() {
    }

    private static long edgePos(Connection c, String key, String aggregate, long emptyValue) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + aggregate + " FROM list_entries WHERE list_key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long value = rs.getLong(1);
                    return rs.wasNull() ? emptyValue : value;
                }
                return emptyValue;
            }
        }
    }

    private static void insert(Connection c, String key, long pos, String value) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO list_entries(list_key,pos,value,created_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, key);
            ps.setLong(2, pos);
            ps.setString(3, value);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private static List<String> readValues(PreparedStatement ps) throws SQLException {
        List<String> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
        }
        return out;
    }
}

package io.memobank.storage;

import io.memobank.model.ResourceStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

public final class SqliteStatusIndex implements StatusIndex {
    private final Path dbFile;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final AtomicBoolean closed;

    private SqliteStatusIndex(Path dbFile, long busyTimeoutMs) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile;
        this.connectionProperties = new Properties();
        this.connectionProperties.setProperty("busy_timeout", Long.toString(Math.max(0L, busyTimeoutMs)));
        // Per-connection pragma; every connection opened here carries it.
        this.connectionProperties.setProperty("synchronous", "NORMAL");
        this.closed = new AtomicBoolean(false);
    }

    public static SqliteStatusIndex open(Path dbFile, long busyTimeoutMs) {
        SqliteStatusIndex index = new SqliteStatusIndex(dbFile, busyTimeoutMs);
        index.init();
        return index;
    }

    private void init() {
        try {
            Files.createDirectories(dbFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create status index directory: " + dbFile.getParent(), e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS status_index (
                        resource_id TEXT PRIMARY KEY,
                        status TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize status index: " + dbFile, e);
        }
        // NORMAL reads back as 1.
        if (!"1".equals(pragma("synchronous"))) {
            throw new IllegalStateException("PRAGMA synchronous was not applied to new connections: " + dbFile);
        }
    }

    @Override
    public Optional<ResourceStatus> get(String identifier) {
        ensureOpen();
        String sql = "SELECT status FROM status_index WHERE resource_id=?";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, identifier);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(ResourceStatus.fromStored(rs.getString("status")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read status index entry: " + identifier, e);
        }
    }

    @Override
    public void put(String identifier, ResourceStatus status) {
        if (status == null || status == ResourceStatus.UNKNOWN) {
            throw new IllegalArgumentException("Only pending, complete or error can be indexed: " + status);
        }
        ensureOpen();
        String sql = """
                INSERT INTO status_index(resource_id,status,updated_at_ms) VALUES(?,?,?)
                ON CONFLICT(resource_id) DO UPDATE SET status=excluded.status, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, identifier);
            ps.setString(2, status.token());
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write status index entry: " + identifier, e);
        }
    }

    @Override
    public void remove(String identifier) {
        ensureOpen();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM status_index WHERE resource_id=?")) {
            ps.setString(1, identifier);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove status index entry: " + identifier, e);
        }
    }

    @Override
    public List<Entry> scan() {
        ensureOpen();
        List<Entry> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT resource_id,status FROM status_index ORDER BY resource_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new Entry(rs.getString("resource_id"), rs.getString("status")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to scan status index: " + dbFile, e);
        }
        return out;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Status index is closed: " + dbFile);
        }
    }

    /** Reads a pragma on a freshly opened connection. */
    String pragma(String name) {
        try (Connection c = openConnection(); Statement st = c.createStatement()) {
            return readPragma(st, name);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read PRAGMA " + name + ": " + dbFile, e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        String actual = readPragma(st, pragma);
        if (actual == null || !actual.equalsIgnoreCase(expected)) {
            throw new IllegalStateException(
                    "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
            );
        }
    }

    private static String readPragma(Statement st, String pragma) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            return rs.getString(1);
        }
    }
}

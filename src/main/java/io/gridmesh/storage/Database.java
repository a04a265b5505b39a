package io.gridmesh.storage;

import io.gridmesh.config.NodePaths;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final NodePaths paths;
    private final String jdbcUrl;

    public Database(NodePaths paths) {
        this.paths = paths;
        this.jdbcUrl = "jdbc:sqlite:" + paths.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(paths.rootDir());
            Files.createDirectories(paths.auditRoot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        job_id TEXT PRIMARY KEY,
                        owner TEXT NOT NULL,
                        owner_group TEXT,
                        priority INTEGER NOT NULL,
                        requirements TEXT NOT NULL,
                        payload TEXT,
                        submitted_at_ms INTEGER NOT NULL,
                        sequence INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        matched_resource TEXT,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS idempotency (
                        owner TEXT NOT NULL,
                        token TEXT NOT NULL,
                        job_id TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(owner, token)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_owner ON jobs(owner)");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA busy_timeout=5000");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " returned no value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException("PRAGMA " + pragma + " expected " + expected + " but was " + actual);
            }
        }
    }
}

package com.marketintel.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Single-file SQLite database. Each caller opens its own connection; SQLite's busy timeout
 * serializes concurrent writers from parallel runs.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final int BUSY_TIMEOUT_MS = 5000;

    private final Path dbPath;
    private final String jdbcUrl;

    public Database(Path dbPath) {
        if (dbPath == null) {
            throw new IllegalArgumentException("db.path must not be empty");
        }
        this.dbPath = dbPath.toAbsolutePath().normalize();
        Path parent = this.dbPath.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new IllegalStateException("cannot create database directory " + parent + ": " + e.getMessage(), e);
            }
        }
        this.jdbcUrl = "jdbc:sqlite:" + this.dbPath;
    }

    public Connection connect() throws SQLException {
        try {
            return withBusyTimeout(DriverManager.getConnection(jdbcUrl));
        } catch (SQLException e) {
            String details = "DB connect failed: jdbc_url=" + jdbcUrl
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    /**
     * Applies the busy timeout to a freshly opened connection, closing it if that fails.
     */
    static Connection withBusyTimeout(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            try {
                conn.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
        return conn;
    }

    public Path path() {
        return dbPath;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("does not exist")) {
            return "missing_dir";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}

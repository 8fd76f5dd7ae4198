package com.marketintel.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the checkpoint and chat tables. Safe to run on every startup.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);

    public void run(Database database) throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
            } catch (SQLException e) {
                String detail = "migration_failed: db=" + database.path()
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
        }
    }

    private List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("PRAGMA journal_mode=WAL");
        sqls.add("CREATE TABLE IF NOT EXISTS run_states (" +
                "run_id TEXT PRIMARY KEY," +
                "market_domain TEXT NOT NULL," +
                "query TEXT NULL," +
                "state_json TEXT NOT NULL," +
                "created_at TEXT NOT NULL," +
                "updated_at TEXT NOT NULL" +
                ")");
        sqls.add("CREATE TABLE IF NOT EXISTS chat_turns (" +
                "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "session_id TEXT NOT NULL," +
                "role TEXT NOT NULL," +
                "content TEXT NOT NULL," +
                "created_at_ms INTEGER NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_run_states_updated ON run_states(updated_at DESC)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_chat_turns_session ON chat_turns(session_id, created_at_ms, id)");
        return sqls;
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}

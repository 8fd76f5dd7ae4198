package com.marketintel.store;

import com.marketintel.model.ChatRole;
import com.marketintel.model.ChatTurn;
import com.marketintel.model.RunState;
import com.marketintel.store.mybatis.ChatTurnMapper;
import com.marketintel.store.mybatis.ChatTurnRow;
import com.marketintel.store.mybatis.MyBatisSupport;
import com.marketintel.store.mybatis.RunStateMapper;
import com.marketintel.store.mybatis.RunStateRow;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONException;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteRunStateStore implements RunStateStore {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final Database database;

    public SqliteRunStateStore(Database database) {
        this.database = database;
    }

    @Override
    public void put(String runId, RunState state) throws SQLException {
        if (runId == null || runId.isBlank() || state == null) {
            throw new IllegalArgumentException("runId and state are required");
        }
        if (!runId.equals(state.runId())) {
            throw new IllegalArgumentException("runId mismatch: " + runId + " vs " + state.runId());
        }
        RunStateRow row = RunStateRow.builder()
                .runId(runId)
                .marketDomain(state.domain())
                .query(state.query())
                .stateJson(state.toJson().toString())
                .createdAt(TS.format(state.createdAt()))
                .updatedAt(TS.format(Instant.now()))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(RunStateMapper.class).upsertState(row);
            conn.commit();
        }
    }

    @Override
    public Optional<RunState> get(String runId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            RunStateRow row = session.getMapper(RunStateMapper.class).selectState(runId);
            if (row == null) {
                return Optional.empty();
            }
            return Optional.of(decode(row));
        }
    }

    @Override
    public void appendTurn(String sessionId, ChatRole role, String content) throws SQLException {
        if (sessionId == null || sessionId.isBlank() || role == null) {
            throw new IllegalArgumentException("sessionId and role are required");
        }
        ChatTurnRow row = ChatTurnRow.builder()
                .sessionId(sessionId)
                .role(role.wireName())
                .content(content == null ? "" : content)
                .createdAtMs(Instant.now().toEpochMilli())
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(ChatTurnMapper.class).insertTurn(row);
            conn.commit();
        }
    }

    @Override
    public List<ChatTurn> listTurns(String sessionId) throws SQLException {
        List<ChatTurn> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (ChatTurnRow row : session.getMapper(ChatTurnMapper.class).listBySession(sessionId)) {
                out.add(new ChatTurn(
                        row.getSessionId(),
                        ChatRole.fromWire(row.getRole()),
                        row.getContent(),
                        Instant.ofEpochMilli(row.getCreatedAtMs())
                ));
            }
        }
        return out;
    }

    @Override
    public List<RunState> listRecentRuns(int limit) throws SQLException {
        List<RunState> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (RunStateRow row : session.getMapper(RunStateMapper.class).listRecent(Math.max(1, limit))) {
                out.add(decode(row));
            }
        }
        return out;
    }

    private RunState decode(RunStateRow row) throws SQLException {
        try {
            return RunState.fromJson(new JSONObject(row.getStateJson()));
        } catch (JSONException | IllegalArgumentException e) {
            throw new SQLException("corrupt run_states row run_id=" + row.getRunId() + ": " + e.getMessage(), e);
        }
    }
}

package com.marketintel.store;

import com.marketintel.model.ChatRole;
import com.marketintel.model.ChatTurn;
import com.marketintel.model.RunState;
import org.apache.logging.log4j.LogManager;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Durable checkpoints of {@link RunState} plus append-only chat history.
 * Implementations must tolerate concurrent callers from simultaneous runs.
 */
public interface RunStateStore {

    /**
     * Upserts the snapshot for {@code runId}; the last write wins. Returns once the write is durable.
     */
    void put(String runId, RunState state) throws SQLException;

    Optional<RunState> get(String runId) throws SQLException;

    void appendTurn(String sessionId, ChatRole role, String content) throws SQLException;

    /**
     * Turns for the session, oldest first.
     */
    List<ChatTurn> listTurns(String sessionId) throws SQLException;

    List<RunState> listRecentRuns(int limit) throws SQLException;

    /**
     * Pipeline checkpoint: same as {@link #put} but a failure is logged and reported as {@code false}.
     */
    default boolean checkpointPut(RunState state) {
        try {
            put(state.runId(), state);
            return true;
        } catch (SQLException | RuntimeException e) {
            LogManager.getLogger(RunStateStore.class)
                    .error("checkpoint failed run_id={} err={}", state.runId(), e.getMessage(), e);
            return false;
        }
    }
}

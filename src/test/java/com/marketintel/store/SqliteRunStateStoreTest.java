package com.marketintel.store;

import com.marketintel.model.ChatRole;
import com.marketintel.model.ChatTurn;
import com.marketintel.model.CollectedDocument;
import com.marketintel.model.RunState;
import com.marketintel.model.Trend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteRunStateStoreTest {
    @TempDir
    Path tempDir;

    private SqliteRunStateStore store;

    @BeforeEach
    void setUp() throws SQLException {
        Database database = new Database(tempDir.resolve("state.db"));
        new MigrationRunner().run(database);
        store = new SqliteRunStateStore(database);
    }

    @Test
    void put_twiceWithSameStateShouldLeaveOneEqualSnapshot() throws SQLException {
        RunState state = RunState.create("Technology", "AI regulation", "");
        state.setTrends(List.of(Trend.placeholder()));

        store.put(state.runId(), state);
        store.put(state.runId(), state);

        assertEquals(state, store.get(state.runId()).orElseThrow());
        assertEquals(1, store.listRecentRuns(10).size());
    }

    @Test
    void put_shouldKeepLastWrite() throws SQLException {
        RunState state = RunState.create("Technology", "", "");
        store.put(state.runId(), state);

        state.setCollectedDocuments(List.of(new CollectedDocument("web", "T", "S", "F", "https://x.example")));
        store.put(state.runId(), state);

        assertEquals(1, store.get(state.runId()).orElseThrow().collectedDocuments().size());
    }

    @Test
    void get_shouldReturnEmptyForUnknownRun() throws SQLException {
        assertFalse(store.get("missing").isPresent());
    }

    @Test
    void put_shouldRejectMismatchedRunId() {
        RunState state = RunState.create("Technology", "", "");

        assertThrows(IllegalArgumentException.class, () -> store.put("other-id", state));
    }

    @Test
    void listTurns_shouldReturnSessionTurnsOldestFirst() throws SQLException {
        store.appendTurn("s1", ChatRole.USER, "hello");
        store.appendTurn("s2", ChatRole.USER, "other session");
        store.appendTurn("s1", ChatRole.ASSISTANT, "hi there");
        store.appendTurn("s1", ChatRole.USER, "what about EVs?");

        List<ChatTurn> turns = store.listTurns("s1");

        assertEquals(3, turns.size());
        assertEquals("hello", turns.get(0).content());
        assertEquals(ChatRole.ASSISTANT, turns.get(1).role());
        assertEquals("what about EVs?", turns.get(2).content());
        assertTrue(store.listTurns("nobody").isEmpty());
    }

    @Test
    void checkpointPut_shouldReportFailureWithoutThrowing() throws SQLException {
        RunStateStore broken = new RunStateStore() {
            @Override
            public void put(String runId, RunState state) throws SQLException {
                throw new SQLException("disk full");
            }

            @Override
            public java.util.Optional<RunState> get(String runId) {
                return java.util.Optional.empty();
            }

            @Override
            public void appendTurn(String sessionId, ChatRole role, String content) {
            }

            @Override
            public List<ChatTurn> listTurns(String sessionId) {
                return List.of();
            }

            @Override
            public List<RunState> listRecentRuns(int limit) {
                return List.of();
            }
        };
        RunState state = RunState.create("Technology", "", "");

        assertFalse(broken.checkpointPut(state));
        assertTrue(store.checkpointPut(state));
        assertTrue(store.get(state.runId()).isPresent());
    }

    @Test
    void put_shouldTolerateConcurrentRuns() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<RunState> states = new ArrayList<>();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                RunState state = RunState.create("Market " + i, "", "");
                states.add(state);
                futures.add(pool.submit(() -> {
                    store.put(state.runId(), state);
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        for (RunState state : states) {
            assertEquals(state, store.get(state.runId()).orElseThrow());
        }
    }
}

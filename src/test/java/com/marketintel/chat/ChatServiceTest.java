package com.marketintel.chat;

import com.marketintel.llm.TextGenerator;
import com.marketintel.model.ChatRole;
import com.marketintel.model.ChatTurn;
import com.marketintel.store.Database;
import com.marketintel.store.MigrationRunner;
import com.marketintel.store.SqliteRunStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatServiceTest {

    @TempDir
    Path tempDir;

    private SqliteRunStateStore store;

    @BeforeEach
    void setUp() throws Exception {
        Database database = new Database(tempDir.resolve("chat.db"));
        new MigrationRunner().run(database);
        store = new SqliteRunStateStore(database);
    }

    @Test
    void send_shouldBuildReplyFromFullSessionHistory() throws Exception {
        RecordingGenerator generator = new RecordingGenerator("Solar and storage.", "Storage grows fastest.");
        ChatService chat = new ChatService(store, generator);

        assertEquals("Solar and storage.", chat.send("s1", "What is hot in energy?"));
        assertEquals("Storage grows fastest.", chat.send("s1", "Which grows fastest?"));

        String secondPrompt = generator.prompts.get(1);
        assertTrue(secondPrompt.contains("User: What is hot in energy?\nAssistant: Solar and storage.\nUser: Which grows fastest?"));
        assertTrue(secondPrompt.endsWith("Assistant:"));

        List<ChatTurn> history = chat.history("s1");
        assertEquals(4, history.size());
        assertEquals(ChatRole.USER, history.get(0).role());
        assertEquals(ChatRole.ASSISTANT, history.get(3).role());
    }

    @Test
    void send_shouldRecordApologyWhenModelFails() throws Exception {
        ChatService chat = new ChatService(store, (system, user) -> {
            throw new IllegalStateException("offline");
        });

        assertEquals(ChatService.ERROR_REPLY, chat.send("s2", "hello"));
        assertEquals(ChatService.ERROR_REPLY, chat.history("s2").get(1).content());
    }

    @Test
    void send_shouldKeepSessionsApart() throws Exception {
        ChatService chat = new ChatService(store, new RecordingGenerator("a", "b"));
        chat.send("left", "one");
        chat.send("right", "two");

        assertEquals(2, chat.history("left").size());
        assertEquals("two", chat.history("right").get(0).content());
    }

    @Test
    void send_shouldRejectBlankInput() {
        ChatService chat = new ChatService(store, new RecordingGenerator("x"));
        assertThrows(IllegalArgumentException.class, () -> chat.send(" ", "hello"));
        assertThrows(IllegalArgumentException.class, () -> chat.send("s", " "));
    }

    private static final class RecordingGenerator implements TextGenerator {
        private final List<String> replies;
        private final List<String> prompts = new ArrayList<>();

        private RecordingGenerator(String... replies) {
            this.replies = List.of(replies);
        }

        @Override
        public String complete(String systemInstruction, String userContent) {
            prompts.add(userContent);
            return replies.get(Math.min(prompts.size() - 1, replies.size() - 1));
        }
    }
}

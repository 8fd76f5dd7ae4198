package com.marketintel.chat;

import com.marketintel.llm.TextGenerator;
import com.marketintel.model.ChatRole;
import com.marketintel.model.ChatTurn;
import com.marketintel.pipeline.Prompts;
import com.marketintel.store.RunStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;

/**
 * Session chat over the generator. Both sides of every exchange are appended to the store, so
 * each reply is built from the full session history.
 */
public final class ChatService {
    private static final Logger LOG = LogManager.getLogger(ChatService.class);
    public static final String ERROR_REPLY = "Sorry, I encountered an error while processing your message.";

    private final RunStateStore store;
    private final TextGenerator generator;

    public ChatService(RunStateStore store, TextGenerator generator) {
        this.store = store;
        this.generator = generator;
    }

    /**
     * Appends the user message, generates a reply from the session history and appends the reply.
     *
     * @throws IllegalArgumentException if the session id or message is blank
     * @throws SQLException             if the history cannot be read or written
     */
    public String send(String sessionId, String message) throws SQLException {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session id must not be empty");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be empty");
        }
        String session = sessionId.trim();
        store.appendTurn(session, ChatRole.USER, message.trim());
        List<ChatTurn> history = store.listTurns(session);

        String reply;
        try {
            reply = generator.complete(Prompts.CHAT, transcript(history));
            if (reply == null || reply.isBlank()) {
                reply = ERROR_REPLY;
            } else {
                reply = reply.trim();
            }
        } catch (Exception e) {
            LOG.warn("chat reply failed session={} err={}", session, e.getMessage());
            reply = ERROR_REPLY;
        }
        store.appendTurn(session, ChatRole.ASSISTANT, reply);
        return reply;
    }

    public List<ChatTurn> history(String sessionId) throws SQLException {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session id must not be empty");
        }
        return store.listTurns(sessionId.trim());
    }

    static String transcript(List<ChatTurn> history) {
        StringBuilder sb = new StringBuilder();
        for (ChatTurn turn : history) {
            sb.append(turn.role() == ChatRole.USER ? "User: " : "Assistant: ")
                    .append(turn.content())
                    .append('\n');
        }
        sb.append("Assistant:");
        return sb.toString();
    }
}

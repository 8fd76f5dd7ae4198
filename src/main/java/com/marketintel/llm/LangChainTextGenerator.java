package com.marketintel.llm;

import com.marketintel.config.Config;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TextGenerator} backed by a LangChain4j Ollama chat model.
 * If the model cannot be built every call fails, which callers treat like any other model error.
 */
public final class LangChainTextGenerator implements TextGenerator {
    private static final Logger LOG = LogManager.getLogger(LangChainTextGenerator.class);

    private final ChatLanguageModel chatModel;

    public LangChainTextGenerator(Config config) {
        ChatLanguageModel built;
        try {
            built = OllamaChatModel.builder()
                    .baseUrl(config.getString("llm.base_url", "http://127.0.0.1:11434"))
                    .modelName(config.getString("llm.model", "llama3.1:latest"))
                    .temperature(config.getDouble("llm.temperature", 0.2))
                    .timeout(Duration.ofSeconds(Math.max(10, config.getInt("llm.timeout_sec", 180))))
                    .build();
        } catch (Exception e) {
            LOG.warn("failed to initialize LangChain4j Ollama model: {}", e.getMessage());
            built = null;
        }
        this.chatModel = built;
    }

    LangChainTextGenerator(ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
    }

    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public String complete(String systemInstruction, String userContent) {
        if (chatModel == null) {
            throw new IllegalStateException("generative model is not configured");
        }
        List<ChatMessage> messages = new ArrayList<>();
        if (systemInstruction != null && !systemInstruction.isBlank()) {
            messages.add(SystemMessage.from(systemInstruction));
        }
        messages.add(UserMessage.from(userContent == null || userContent.isBlank() ? "(no input)" : userContent));
        Response<AiMessage> response = chatModel.generate(messages);
        AiMessage message = response == null ? null : response.content();
        String text = message == null ? null : message.text();
        return text == null ? "" : text;
    }
}

package com.marketintel.llm;

/**
 * Generative-text capability. Implementations apply their own timeout and throw on failure.
 */
public interface TextGenerator {
    String complete(String systemInstruction, String userContent) throws Exception;
}

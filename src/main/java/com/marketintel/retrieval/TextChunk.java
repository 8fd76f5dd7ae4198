package com.marketintel.retrieval;

import java.util.Map;

/**
 * A piece of text with its source metadata (source, url, title).
 */
public record TextChunk(String text, Map<String, String> metadata) {
    public TextChunk {
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

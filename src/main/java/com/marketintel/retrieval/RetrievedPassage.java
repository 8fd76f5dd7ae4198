package com.marketintel.retrieval;

import java.util.Map;

public record RetrievedPassage(String text, Map<String, String> metadata, double score) {
    public RetrievedPassage {
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Best human-readable reference: title, then url, then source.
     */
    public String citation() {
        for (String key : new String[]{"title", "url", "source"}) {
            String value = metadata.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "Unknown Source";
    }
}

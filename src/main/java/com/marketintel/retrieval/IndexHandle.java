package com.marketintel.retrieval;

/**
 * Opaque reference to a built retrieval index.
 */
public record IndexHandle(String id, int passageCount) {
    public IndexHandle {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("index handle id must not be empty");
        }
        passageCount = Math.max(0, passageCount);
    }
}

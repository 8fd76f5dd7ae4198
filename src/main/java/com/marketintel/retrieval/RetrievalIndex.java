package com.marketintel.retrieval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface RetrievalIndex {

    IndexHandle build(List<TextChunk> chunks) throws Exception;

    /**
     * Up to {@code k} passages scoring at least {@code threshold}, best first.
     */
    List<RetrievedPassage> query(IndexHandle handle, String question, int k, double threshold) throws Exception;

    /**
     * Writes the index under {@code dir} when the implementation supports it.
     */
    default Optional<Path> persist(IndexHandle handle, Path dir) throws IOException {
        return Optional.empty();
    }

    /**
     * Frees whatever the index holds for {@code handle}.
     */
    default void release(IndexHandle handle) {
    }
}

package com.marketintel.retrieval;

import com.marketintel.config.Config;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RetrievalIndex} over LangChain4j in-memory embedding stores, one store per handle.
 * Scores are the store's relevance scores in [0, 1].
 */
public final class EmbeddingRetrievalIndex implements RetrievalIndex {
    private final EmbeddingModel embeddingModel;
    private final Map<String, InMemoryEmbeddingStore<TextSegment>> stores = new ConcurrentHashMap<>();

    public EmbeddingRetrievalIndex(Config config) {
        this(OllamaEmbeddingModel.builder()
                .baseUrl(config.getString("llm.base_url", "http://127.0.0.1:11434"))
                .modelName(config.getString("embedding.model", "nomic-embed-text"))
                .timeout(Duration.ofSeconds(Math.max(10, config.getInt("llm.timeout_sec", 180))))
                .build());
    }

    public EmbeddingRetrievalIndex(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public IndexHandle build(List<TextChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("cannot build an index without chunks");
        }
        List<TextSegment> segments = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            Metadata metadata = new Metadata();
            chunk.metadata().forEach(metadata::put);
            segments.add(TextSegment.from(chunk.text(), metadata));
        }
        Response<List<Embedding>> response = embeddingModel.embedAll(segments);
        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != segments.size()) {
            throw new IllegalStateException("embedding model returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + segments.size() + " segments");
        }
        InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
        store.addAll(embeddings, segments);
        IndexHandle handle = new IndexHandle(UUID.randomUUID().toString(), segments.size());
        stores.put(handle.id(), store);
        return handle;
    }

    @Override
    public List<RetrievedPassage> query(IndexHandle handle, String question, int k, double threshold) {
        InMemoryEmbeddingStore<TextSegment> store = handle == null ? null : stores.get(handle.id());
        if (store == null) {
            throw new IllegalStateException("unknown index handle: " + (handle == null ? "null" : handle.id()));
        }
        Embedding queryEmbedding = embeddingModel.embed(question).content();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(Math.max(1, k))
                .minScore(threshold)
                .build();
        List<RetrievedPassage> out = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : store.search(request).matches()) {
            TextSegment segment = match.embedded();
            if (segment == null) {
                continue;
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            segment.metadata().toMap().forEach((key, value) -> metadata.put(key, String.valueOf(value)));
            out.add(new RetrievedPassage(segment.text(), metadata, match.score() == null ? 0.0 : match.score()));
        }
        return out;
    }

    @Override
    public Optional<Path> persist(IndexHandle handle, Path dir) throws IOException {
        InMemoryEmbeddingStore<TextSegment> store = handle == null ? null : stores.get(handle.id());
        if (store == null) {
            return Optional.empty();
        }
        Files.createDirectories(dir);
        Path file = dir.resolve("index.json");
        store.serializeToFile(file);
        return Optional.of(file);
    }

    @Override
    public void release(IndexHandle handle) {
        if (handle != null) {
            stores.remove(handle.id());
        }
    }
}

package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.model.CollectedDocument;
import com.marketintel.model.RunState;
import com.marketintel.model.SynthesisItem;
import com.marketintel.retrieval.IndexHandle;
import com.marketintel.retrieval.RetrievalIndex;
import com.marketintel.retrieval.TextChunk;
import com.marketintel.retrieval.TextChunker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chunks collected documents and synthesis outputs and builds the retrieval index over them.
 * No chunks, or a failed build, leaves the run without an index handle.
 */
public final class IndexingStage implements Stage {
    private static final Logger LOG = LogManager.getLogger(IndexingStage.class);
    public static final String INDEX_DIR = "vector_store";

    private final RetrievalIndex index;
    private final TextChunker chunker;

    public IndexingStage(RetrievalIndex index, TextChunker chunker) {
        this.index = index;
        this.chunker = chunker;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.INDEX;
    }

    @Override
    public StageResult run(RunState state) {
        state.setIndexHandle(null);
        List<TextChunk> chunks = chunker.chunk(blocks(state));
        if (chunks.isEmpty()) {
            LOG.warn("no indexable content for run {}, continuing without an index", state.runId());
            return StageResult.skipped("no chunks");
        }

        IndexHandle handle;
        try {
            handle = index.build(chunks);
        } catch (Exception e) {
            LOG.warn("index build failed for run {}: {}", state.runId(), e.getMessage());
            return StageResult.degraded("index build failed: " + e.getMessage());
        }
        if (handle == null || handle.passageCount() <= 0) {
            return StageResult.degraded("index build returned no passages");
        }
        state.setIndexHandle(handle);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("chunks", chunks.size());
        if (state.outputDir() != null) {
            try {
                Optional<Path> persisted = index.persist(handle, state.outputDir().resolve(INDEX_DIR));
                persisted.ifPresent(path -> evidence.put("index_file", path.toString()));
            } catch (IOException e) {
                LOG.warn("index persist failed for run {}: {}", state.runId(), e.getMessage());
            }
        }
        return StageResult.success("chunks=" + chunks.size(), evidence);
    }

    static List<TextChunk> blocks(RunState state) {
        List<TextChunk> blocks = new ArrayList<>();
        for (CollectedDocument doc : state.collectedDocuments()) {
            if (!doc.hasText()) {
                continue;
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("source", "web_document");
            metadata.put("url", nz(doc.url));
            metadata.put("title", nz(doc.title));
            String text = "Title: " + nz(doc.title) + "\nURL: " + nz(doc.url) + "\nContent: " + doc.fullText;
            blocks.add(new TextChunk(text, metadata));
        }
        addSynthesisBlock(blocks, state, "Market Trends Analysis", "trends", state.trends());
        addSynthesisBlock(blocks, state, "Identified Opportunities", "opportunities", state.opportunities());
        addSynthesisBlock(blocks, state, "Strategic Recommendations", "recommendations", state.recommendations());
        return blocks;
    }

    private static void addSynthesisBlock(
            List<TextChunk> blocks,
            RunState state,
            String heading,
            String kind,
            List<? extends SynthesisItem> items
    ) {
        if (items.isEmpty()) {
            return;
        }
        JSONArray array = new JSONArray();
        for (SynthesisItem item : items) {
            array.put(item.toJson());
        }
        String text = heading + " for " + state.domain() + " (Query: " + state.query() + "):\n" + array.toString(2);
        blocks.add(new TextChunk(text, Map.of("source", "agent_generated_" + kind)));
    }

    private static String nz(String value) {
        return value == null ? "" : value;
    }
}

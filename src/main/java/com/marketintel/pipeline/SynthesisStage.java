package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.extract.StructuredOutputExtractor;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.CollectedDocument;
import com.marketintel.model.RunState;
import com.marketintel.model.SynthesisItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Shared shape of the model-backed stages: build input from a bounded sample of upstream state,
 * call the generator, extract structured output and commit it, or commit the stage default on
 * any failure. A synthesis stage never throws.
 */
public abstract class SynthesisStage implements Stage {
    private static final Logger LOG = LogManager.getLogger(SynthesisStage.class);

    protected final TextGenerator generator;
    protected final StructuredOutputExtractor extractor;
    protected final int sampleSize;

    protected SynthesisStage(TextGenerator generator, StructuredOutputExtractor extractor, int sampleSize) {
        this.generator = generator;
        this.extractor = extractor;
        this.sampleSize = Math.max(1, sampleSize);
    }

    @Override
    public final StageResult run(RunState state) {
        try {
            return synthesize(state);
        } catch (Exception e) {
            LOG.warn("{} failed, committing default: {}", step(), e.getMessage());
            applyDefault(state);
            return StageResult.degraded("default committed: " + e.getMessage());
        }
    }

    /**
     * Produces and assigns the stage output. May throw; the caller then applies the default.
     */
    protected abstract StageResult synthesize(RunState state) throws Exception;

    protected abstract void applyDefault(RunState state);

    /**
     * Parses {@code raw} into typed items. Empty when the extracted value is not a non-empty array
     * whose every element is an object accepted by {@code valid}.
     */
    protected <T> Optional<List<T>> parseItems(
            String raw,
            Predicate<JSONObject> valid,
            Function<JSONObject, T> mapper
    ) {
        JSONArray array = extractor.extractArray(raw, null);
        if (array == null || array.isEmpty()) {
            return Optional.empty();
        }
        List<T> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object element = array.get(i);
            if (!(element instanceof JSONObject object) || !valid.test(object)) {
                return Optional.empty();
            }
            out.add(mapper.apply(object));
        }
        return Optional.of(out);
    }

    /**
     * Assigns either the parsed items or the default list and reports which one was committed.
     */
    protected <T> StageResult commit(
            Optional<List<T>> parsed,
            Consumer<List<T>> setter,
            List<T> defaults,
            String label
    ) {
        if (parsed.isPresent()) {
            setter.accept(parsed.get());
            return StageResult.success(label + "=" + parsed.get().size());
        }
        LOG.warn("{} output did not validate, committing default", step());
        setter.accept(defaults);
        return StageResult.degraded("model output did not validate, default committed");
    }

    protected JSONArray sampleItems(List<? extends SynthesisItem> items) {
        JSONArray out = new JSONArray();
        for (int i = 0; i < Math.min(sampleSize, items.size()); i++) {
            out.put(items.get(i).toJson());
        }
        return out;
    }

    protected JSONArray sampleDocuments(List<CollectedDocument> documents) {
        JSONArray out = new JSONArray();
        for (int i = 0; i < Math.min(sampleSize, documents.size()); i++) {
            CollectedDocument doc = documents.get(i);
            out.put(new JSONObject()
                    .put("title", doc.title == null ? "" : doc.title)
                    .put("summary", doc.summary == null ? "" : doc.summary)
                    .put("url", doc.url == null ? "" : doc.url));
        }
        return out;
    }
}

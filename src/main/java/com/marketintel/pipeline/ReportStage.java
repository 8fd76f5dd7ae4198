package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.RunState;
import com.marketintel.output.ArtifactWriter;
import com.marketintel.output.ReportRenderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal drain of every run. Writes a non-empty report whatever upstream produced, then the
 * workspace README.
 * <p>
 * Content comes from the model filling the run's template; when the model fails or returns
 * nothing the deterministic renderer is used; when rendering fails an error document is written.
 */
public final class ReportStage implements Stage {
    private static final Logger LOG = LogManager.getLogger(ReportStage.class);
    public static final String README_FILE = "README.md";

    private final TextGenerator generator;
    private final ReportRenderer renderer;
    private final ArtifactWriter artifactWriter;

    public ReportStage(TextGenerator generator, ReportRenderer renderer, ArtifactWriter artifactWriter) {
        this.generator = generator;
        this.renderer = renderer;
        this.artifactWriter = artifactWriter;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.REPORT;
    }

    public static String reportFileName(RunState state) {
        return ArtifactWriter.domainSlug(state.domain()) + "_report_" + state.shortId(4) + ".md";
    }

    public static String fallbackReport(String domain) {
        return "# Fallback Report: " + domain + "\n\nLLM failed to generate content.";
    }

    public static String errorReport(String message) {
        return "# REPORT GENERATION ERROR\n\n" + message;
    }

    @Override
    public StageResult run(RunState state) throws IOException {
        String content;
        StageResult result;
        try {
            content = generate(state);
            if (content == null || content.isBlank()) {
                LOG.warn("report content empty for run {}, writing fallback", state.runId());
                content = fallbackReport(state.domain());
                result = StageResult.degraded("fallback report");
            } else {
                result = StageResult.success("report_chars=" + content.length());
            }
        } catch (Exception e) {
            LOG.error("report generation failed for run {}: {}", state.runId(), e.getMessage(), e);
            content = errorReport(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            result = StageResult.degraded("error report written");
        }

        Files.createDirectories(state.outputDir());
        String fileName = reportFileName(state);
        artifactWriter.writeText(state.outputDir(), fileName, content);
        state.setReportFile(fileName);
        writeReadme(state);
        return result;
    }

    private String generate(RunState state) {
        String template = state.reportTemplate().orElse(TemplateStage.skeleton(state.domain()));
        try {
            String raw = generator.complete(Prompts.REPORT_GENERATION, userContent(state, template));
            String report = TemplateStage.stripFences(raw);
            if (!report.isEmpty()) {
                return report;
            }
            LOG.warn("model returned an empty report for run {}, rendering from state", state.runId());
        } catch (Exception e) {
            LOG.warn("model report failed for run {}, rendering from state: {}", state.runId(), e.getMessage());
        }
        return renderer.renderReport(state);
    }

    private static String userContent(RunState state, String template) {
        JSONArray trends = new JSONArray();
        state.trends().forEach(t -> trends.put(t.toJson()));
        JSONArray opportunities = new JSONArray();
        state.opportunities().forEach(o -> opportunities.put(o.toJson()));
        JSONArray recommendations = new JSONArray();
        state.recommendations().forEach(r -> recommendations.put(r.toJson()));
        JSONArray sources = new JSONArray();
        state.collectedDocuments().forEach(d -> sources.put(new JSONObject().put("title", d.title).put("url", d.url)));
        JSONObject results = new JSONObject()
                .put("market_domain", state.domain())
                .put("query", state.query())
                .put("market_trends", trends)
                .put("opportunities", opportunities)
                .put("strategic_recommendations", recommendations)
                .put("data_sources", sources);
        state.answer().ifPresent(a -> results.put("question", state.question()).put("answer", a));
        return "Template:\n" + template + "\n\nAnalysis results:\n" + results.toString(2);
    }

    private void writeReadme(RunState state) {
        Map<String, String> files = new LinkedHashMap<>();
        state.reportFile().ifPresent(f -> files.put(f, "Market intelligence report"));
        for (String dataFile : state.dataFiles()) {
            files.put(dataFile, dataFile.endsWith(".csv") ? "Collected sources, tabular" : "Collected data, JSON");
        }
        state.ragLogFile().ifPresent(f -> files.put(f, "Retrieval questions and answers"));
        for (String chart : state.chartRefs()) {
            files.put(chart, "Chart");
        }
        Path indexFile = state.outputDir().resolve(IndexingStage.INDEX_DIR).resolve("index.json");
        if (Files.exists(indexFile)) {
            files.put(IndexingStage.INDEX_DIR + "/index.json", "Serialized retrieval index");
        }
        try {
            artifactWriter.writeText(state.outputDir(), README_FILE, renderer.renderReadme(state, files));
        } catch (IOException | RuntimeException e) {
            LOG.warn("README not written for run {}: {}", state.runId(), e.getMessage());
        }
    }
}

package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.extract.StructuredOutputExtractor;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.RunState;
import org.json.JSONObject;

import java.util.regex.Pattern;

/**
 * Asks the model for a Markdown report template. Fence markers are stripped; an empty result
 * falls back to {@link #skeleton(String)}.
 */
public final class TemplateStage extends SynthesisStage {
    private static final Pattern FENCE_MARKER = Pattern.compile("(?m)^[ \\t]*```+[A-Za-z0-9_+-]*[ \\t]*$\\r?\\n?");

    public TemplateStage(TextGenerator generator, StructuredOutputExtractor extractor, int sampleSize) {
        super(generator, extractor, sampleSize);
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.TEMPLATE;
    }

    @Override
    protected StageResult synthesize(RunState state) throws Exception {
        JSONObject input = new JSONObject()
                .put("market_domain", state.domain())
                .put("query", state.query())
                .put("document_count", state.collectedDocuments().size())
                .put("financial_item_count", state.financialItems().size())
                .put("trend_count", state.trends().size())
                .put("opportunity_count", state.opportunities().size())
                .put("recommendation_count", state.recommendations().size())
                .put("market_trends", sampleItems(state.trends()))
                .put("opportunities", sampleItems(state.opportunities()))
                .put("strategic_recommendations", sampleItems(state.recommendations()));
        String template = stripFences(generator.complete(Prompts.REPORT_TEMPLATE, input.toString(2)));
        if (template.isEmpty()) {
            applyDefault(state);
            return StageResult.degraded("empty template, skeleton committed");
        }
        state.setReportTemplate(template);
        return StageResult.success("template_chars=" + template.length());
    }

    @Override
    protected void applyDefault(RunState state) {
        state.setReportTemplate(skeleton(state.domain()));
    }

    public static String stripFences(String raw) {
        if (raw == null) {
            return "";
        }
        return FENCE_MARKER.matcher(raw).replaceAll("").replace("```", "").trim();
    }

    public static String skeleton(String domain) {
        return String.join("\n",
                "# Market Intelligence Report: " + domain,
                "",
                "## Executive Summary",
                "",
                "## Key Trends",
                "",
                "## Opportunities",
                "",
                "## Strategic Recommendations",
                "",
                "## Data Sources",
                ""
        );
    }
}

package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.extract.StructuredOutputExtractor;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.FinancialItem;
import com.marketintel.model.RunState;
import com.marketintel.model.Trend;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Derives market trends from the collected documents and financial data.
 */
public final class TrendAnalysisStage extends SynthesisStage {

    public TrendAnalysisStage(TextGenerator generator, StructuredOutputExtractor extractor, int sampleSize) {
        super(generator, extractor, sampleSize);
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.TREND;
    }

    @Override
    protected StageResult synthesize(RunState state) throws Exception {
        JSONArray financial = new JSONArray();
        List<FinancialItem> items = state.financialItems();
        for (int i = 0; i < Math.min(sampleSize, items.size()); i++) {
            financial.put(items.get(i).toJson());
        }
        JSONObject input = new JSONObject()
                .put("market_domain", state.domain())
                .put("query", state.query())
                .put("documents", sampleDocuments(state.collectedDocuments()))
                .put("financial_data", financial);
        String raw = generator.complete(Prompts.TREND_ANALYSIS, input.toString(2));
        return commit(parseItems(raw, Trend::isValid, Trend::fromJson), state::setTrends, defaults(), "trends");
    }

    @Override
    protected void applyDefault(RunState state) {
        state.setTrends(defaults());
    }

    static List<Trend> defaults() {
        return List.of(Trend.placeholder());
    }
}

package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.extract.StructuredOutputExtractor;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.Recommendation;
import com.marketintel.model.RunState;
import org.json.JSONObject;

import java.util.List;

public final class StrategyStage extends SynthesisStage {

    public StrategyStage(TextGenerator generator, StructuredOutputExtractor extractor, int sampleSize) {
        super(generator, extractor, sampleSize);
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.STRATEGY;
    }

    @Override
    protected StageResult synthesize(RunState state) throws Exception {
        JSONObject input = new JSONObject()
                .put("market_domain", state.domain())
                .put("market_trends", sampleItems(state.trends()))
                .put("opportunities", sampleItems(state.opportunities()));
        String raw = generator.complete(Prompts.STRATEGY_RECOMMENDATION, input.toString(2));
        return commit(
                parseItems(raw, Recommendation::isValid, Recommendation::fromJson),
                state::setRecommendations,
                defaults(),
                "recommendations"
        );
    }

    @Override
    protected void applyDefault(RunState state) {
        state.setRecommendations(defaults());
    }

    static List<Recommendation> defaults() {
        return List.of(Recommendation.placeholder());
    }
}

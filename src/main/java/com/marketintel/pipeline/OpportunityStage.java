package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.extract.StructuredOutputExtractor;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.Opportunity;
import com.marketintel.model.RunState;
import org.json.JSONObject;

import java.util.List;

/**
 * Turns trends and documents into business opportunities.
 */
public final class OpportunityStage extends SynthesisStage {

    public OpportunityStage(TextGenerator generator, StructuredOutputExtractor extractor, int sampleSize) {
        super(generator, extractor, sampleSize);
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.OPPORTUNITY;
    }

    @Override
    protected StageResult synthesize(RunState state) throws Exception {
        JSONObject input = new JSONObject()
                .put("market_domain", state.domain())
                .put("market_trends", sampleItems(state.trends()))
                .put("documents", sampleDocuments(state.collectedDocuments()));
        String raw = generator.complete(Prompts.OPPORTUNITY_IDENTIFICATION, input.toString(2));
        return commit(
                parseItems(raw, Opportunity::isValid, Opportunity::fromJson),
                state::setOpportunities,
                defaults(),
                "opportunities"
        );
    }

    @Override
    protected void applyDefault(RunState state) {
        state.setOpportunities(defaults());
    }

    static List<Opportunity> defaults() {
        return List.of(Opportunity.placeholder());
    }
}

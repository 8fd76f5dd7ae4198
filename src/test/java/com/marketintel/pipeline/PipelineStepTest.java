package com.marketintel.pipeline;

import com.marketintel.model.RunState;
import com.marketintel.retrieval.IndexHandle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineStepTest {

    @Test
    void next_shouldFollowLinearOrderUpToIndex() {
        RunState state = RunState.create("Technology", "", "");
        assertEquals(PipelineStep.TREND, PipelineStep.COLLECT.next(state));
        assertEquals(PipelineStep.OPPORTUNITY, PipelineStep.TREND.next(state));
        assertEquals(PipelineStep.STRATEGY, PipelineStep.OPPORTUNITY.next(state));
        assertEquals(PipelineStep.TEMPLATE, PipelineStep.STRATEGY.next(state));
        assertEquals(PipelineStep.INDEX, PipelineStep.TEMPLATE.next(state));
        assertEquals(PipelineStep.DONE, PipelineStep.REPORT.next(state));
    }

    @Test
    void next_shouldGoToRetrievalOnlyWithQuestionAndIndex() {
        RunState withBoth = RunState.create("Technology", "", "What is driving growth?");
        withBoth.setIndexHandle(new IndexHandle("h1", 3));
        assertEquals(PipelineStep.RETRIEVAL_ANSWER, PipelineStep.INDEX.next(withBoth));
        assertEquals(PipelineStep.REPORT, PipelineStep.RETRIEVAL_ANSWER.next(withBoth));

        RunState questionOnly = RunState.create("Technology", "", "What is driving growth?");
        assertEquals(PipelineStep.REPORT, PipelineStep.INDEX.next(questionOnly));

        RunState indexOnly = RunState.create("Technology", "", "");
        indexOnly.setIndexHandle(new IndexHandle("h2", 1));
        assertEquals(PipelineStep.REPORT, PipelineStep.INDEX.next(indexOnly));
    }

    @Test
    void isTerminal_shouldOnlyHoldForDone() {
        assertTrue(PipelineStep.DONE.isTerminal());
        assertFalse(PipelineStep.REPORT.isTerminal());
        assertEquals(PipelineStep.DONE, PipelineStep.DONE.next(RunState.create("Energy", "", "")));
    }
}

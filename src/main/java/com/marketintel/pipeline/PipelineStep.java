package com.marketintel.pipeline;

import com.marketintel.model.RunState;

/**
 * States of the run state machine, in pipeline order.
 */
public enum PipelineStep {
    COLLECT,
    TREND,
    OPPORTUNITY,
    STRATEGY,
    TEMPLATE,
    INDEX,
    RETRIEVAL_ANSWER,
    REPORT,
    DONE;

    /**
     * Transition function. The only choice node is {@link #INDEX}: it goes to
     * {@link #RETRIEVAL_ANSWER} when the run has a question and an index, else to {@link #REPORT}.
     */
    public PipelineStep next(RunState state) {
        switch (this) {
            case COLLECT:
                return TREND;
            case TREND:
                return OPPORTUNITY;
            case OPPORTUNITY:
                return STRATEGY;
            case STRATEGY:
                return TEMPLATE;
            case TEMPLATE:
                return INDEX;
            case INDEX:
                return state.hasQuestion() && state.indexHandle().isPresent() ? RETRIEVAL_ANSWER : REPORT;
            case RETRIEVAL_ANSWER:
                return REPORT;
            case REPORT:
            case DONE:
            default:
                return DONE;
        }
    }

    public boolean isTerminal() {
        return this == DONE;
    }
}

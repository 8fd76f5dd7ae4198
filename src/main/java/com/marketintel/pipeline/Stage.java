package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.model.RunState;

/**
 * One node of the run state machine. A stage owns a fixed set of {@link RunState} fields and
 * assigns each of them once, either with its output or with its default.
 */
public interface Stage {
    PipelineStep step();

    StageResult run(RunState state) throws Exception;
}

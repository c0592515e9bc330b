package com.nipt.orchestrator.pipeline;

import com.nipt.orchestrator.processing.PipelineInterface;

/**
 * Definition with no steps and no parameters, used for ad-hoc titles that
 * are not backed by an installed package.
 */
public final class EmptyPipeline extends PipelineDefinition {

    public EmptyPipeline(PipelineInterface pipelineInterface) {
        super(pipelineInterface);
    }
}

package com.nipt.orchestrator.api.dto;

import com.nipt.orchestrator.pipeline.PipelineStep;

/**
 * Read-only view of a registered step returned by GET /sessions/{id}/steps.
 */
public record StepResponse(int index, String name, String description) {

    public static StepResponse from(PipelineStep step) {
        return new StepResponse(step.index(), step.name(), step.description());
    }
}

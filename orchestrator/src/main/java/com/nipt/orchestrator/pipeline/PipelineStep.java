package com.nipt.orchestrator.pipeline;

/**
 * One registered unit of work of a pipeline definition.
 *
 * @param index       zero-based position in registration order
 * @param name        unique name within the definition, e.g. "denoise"
 * @param description text shown to users before the step runs
 * @param action      plugin implementation; produces output by writing through the pipeline interface
 */
public record PipelineStep(int index, String name, String description, Runnable action) {}

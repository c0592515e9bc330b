package com.nipt.orchestrator.processing;

import com.nipt.orchestrator.pipeline.PipelineException;

import java.util.List;

/**
 * Three-character identifier of data produced by an earlier step, e.g. "010".
 *
 * Not related to the step index used by {@code run}: codes name stored
 * results, indices name registered steps.
 */
public record StepCode(String value) {

    public static final int LENGTH = 3;

    public StepCode {
        if (value == null || value.length() != LENGTH) {
            throw new PipelineException(PipelineException.Kind.MALFORMED_STEP_CODE,
                    "Step code must be exactly " + LENGTH + " characters: '" + value + "'");
        }
    }

    public static StepCode of(String value) {
        return new StepCode(value);
    }

    /** Validates every code before returning, so a bad element rejects the whole list. */
    public static List<StepCode> allOf(List<String> values) {
        if (values == null) {
            throw new PipelineException(PipelineException.Kind.MALFORMED_STEP_CODE,
                    "Step code list must not be null");
        }
        return values.stream().map(StepCode::of).toList();
    }

    @Override
    public String toString() { return value; }
}

package com.nipt.orchestrator.pipeline;

/**
 * Thrown when an orchestration request is rejected.
 *
 * Unchecked: every kind is surfaced straight to the caller with no retry.
 * The orchestrator's selection and bound parameters are left exactly as
 * they were before the failing call.
 */
public class PipelineException extends RuntimeException {

    public enum Kind {
        INVALID_PACKAGE_IDENTIFIER,
        UNKNOWN_PARAMETER_NAME,
        INVALID_PARAMETER_VALUE,
        NO_PACKAGE_SELECTED,
        UNKNOWN_STEP_INDEX,
        MALFORMED_STEP_CODE
    }

    private final Kind kind;

    public PipelineException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public PipelineException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static PipelineException noPackageSelected() {
        return new PipelineException(Kind.NO_PACKAGE_SELECTED,
                "A pipeline package must be selected first");
    }
}

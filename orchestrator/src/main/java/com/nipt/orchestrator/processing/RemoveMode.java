package com.nipt.orchestrator.processing;

import java.util.Locale;

/**
 * Which kind of stored output {@link PipelineInterface#destroyStep} deletes.
 */
public enum RemoveMode {
    PROCESSING,
    REPORTING,
    MASKING;

    /** Case-insensitive parse; null or blank means {@link #PROCESSING}. */
    public static RemoveMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return PROCESSING;
        }
        try {
            return valueOf(mode.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown remove mode: '" + mode + "'", e);
        }
    }
}

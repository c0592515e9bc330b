package com.nipt.orchestrator.service;

import com.nipt.orchestrator.config.NiptProperties;
import com.nipt.orchestrator.processing.InterfaceOptions;

/**
 * Per-orchestrator overrides. A null field falls back to {@link NiptProperties}.
 */
public record OrchestratorOptions(Boolean logging, Integer threads, Boolean verbose) {

    public static OrchestratorOptions defaults() {
        return new OrchestratorOptions(null, null, null);
    }

    InterfaceOptions interfaceOptions(NiptProperties defaults) {
        return new InterfaceOptions(
                logging != null ? logging : defaults.logging(),
                threads != null ? threads : defaults.numberOfThreads());
    }

    boolean verbose(NiptProperties defaults) {
        return verbose != null ? verbose : defaults.verbose();
    }
}

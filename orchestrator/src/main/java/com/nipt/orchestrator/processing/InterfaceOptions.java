package com.nipt.orchestrator.processing;

/**
 * Settings handed to an {@link InterfaceProvider} when a pipeline interface is opened.
 *
 * @param logging whether the interface writes its own job log files
 * @param threads number of worker threads the interface may use for step jobs
 */
public record InterfaceOptions(boolean logging, int threads) {

    public InterfaceOptions {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, was " + threads);
        }
    }
}

package com.nipt.orchestrator.processing;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Handles of a step whose jobs are currently executing inside a pipeline interface.
 */
public interface RunningStep {

    /** Scheduler threads feeding the step's job queue. */
    List<Thread> schedulers();

    /** Executors running the step's individual jobs. */
    List<ExecutorService> managers();
}

package com.nipt.orchestrator.processing;

import com.nipt.orchestrator.bucket.Bucket;
import com.nipt.orchestrator.bucket.DatasetCategory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Processing interface a pipeline definition is bound to.
 *
 * Supplied by an interface plugin through {@link InterfaceProvider}. It is the
 * only component that writes to the dataset: steps submit jobs through it, it
 * keeps the {@link JobCounters}, and it indexes what every step has produced.
 */
public interface PipelineInterface {

    /** Label of the pipeline package this interface writes under. */
    String label();

    Bucket bucket();

    /** Refresh the produced-data listings from storage. */
    void update();

    /** Step codes present in a namespace, mapped to their step names. */
    SortedMap<String, String> listing(DatasetCategory category);

    /**
     * Storage location of {@code stepCode} inside one namespace,
     * or empty if the namespace does not hold that code.
     */
    Optional<String> locate(DatasetCategory category, String stepCode);

    /** Names of steps whose jobs are waiting to run. */
    List<String> waitingList();

    void destroyStep(String stepCode, RemoveMode mode);

    JobCounters jobCounters();

    /** A new builder for authoring an ad-hoc step against this interface. */
    InterfaceBuilder builder();

    /** Steps currently executing, keyed by step name. */
    Map<String, RunningStep> runningSteps();
}

package com.nipt.orchestrator.pipeline;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Index-addressed dispatch table over the steps of one pipeline definition.
 *
 * <p>Built from the steps the definition registered, in registration order,
 * so indices are contiguous from 0. Invocation is a list lookup followed by a
 * direct call of the plugin's action; every call is timed and counted:
 * <pre>
 *   nipt.step.calls{pipeline, step, status="success|error"}
 *   nipt.step.duration{pipeline, step}
 * </pre>
 */
public class StepRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final String             pipeline;
    private final List<PipelineStep> steps;
    private final MeterRegistry      meterRegistry;

    private StepRegistry(String pipeline, List<PipelineStep> steps, MeterRegistry meterRegistry) {
        this.pipeline      = pipeline;
        this.steps         = steps;
        this.meterRegistry = meterRegistry;
    }

    public static StepRegistry of(PipelineDefinition definition, MeterRegistry meterRegistry) {
        List<PipelineStep> steps = definition.declaredSteps();
        log.debug("Bound {} step(s) for pipeline '{}'", steps.size(), definition.title());
        return new StepRegistry(definition.title(), steps, meterRegistry);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public int size() { return steps.size(); }

    /** Step names keyed by index. */
    public SortedMap<Integer, String> names() {
        SortedMap<Integer, String> names = new TreeMap<>();
        steps.forEach(s -> names.put(s.index(), s.name()));
        return Collections.unmodifiableSortedMap(names);
    }

    public List<PipelineStep> steps() { return steps; }

    public PipelineStep step(int index) {
        if (index < 0 || index >= steps.size()) {
            throw new PipelineException(PipelineException.Kind.UNKNOWN_STEP_INDEX,
                    "Pipeline '%s' has no step at index %d (available: 0..%d)"
                            .formatted(pipeline, index, steps.size() - 1));
        }
        return steps.get(index);
    }

    // ------------------------------------------------------------------
    // Invocation
    // ------------------------------------------------------------------

    /**
     * Run the step at {@code index} on the calling thread.
     * Exceptions thrown by the plugin propagate unchanged after being counted.
     */
    public void invoke(int index) {
        PipelineStep step = step(index);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            log.info("Invoking step {} '{}' of pipeline '{}'", index, step.name(), pipeline);
            step.action().run();
        } catch (RuntimeException | Error e) {
            status = "error";
            log.error("Step '{}' of pipeline '{}' failed: {}", step.name(), pipeline, e.getMessage());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("nipt.step.duration",
                    "pipeline", pipeline, "step", step.name()));
            meterRegistry.counter("nipt.step.calls",
                    "pipeline", pipeline, "step", step.name(), "status", status).increment();
        }
    }
}

package com.nipt.orchestrator.support;

import com.nipt.orchestrator.bucket.Bucket;
import com.nipt.orchestrator.bucket.DatasetCategory;
import com.nipt.orchestrator.processing.InterfaceBuilder;
import com.nipt.orchestrator.processing.JobCounters;
import com.nipt.orchestrator.processing.PipelineInterface;
import com.nipt.orchestrator.processing.RemoveMode;
import com.nipt.orchestrator.processing.RunningStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * In-memory pipeline interface. {@link #produce} stands in for a step writing output.
 */
public class FakePipelineInterface implements PipelineInterface {

    public record Removal(String stepCode, RemoveMode mode) {}

    private final String label;
    private final Bucket bucket;
    private final Map<DatasetCategory, SortedMap<String, String>> produced = new EnumMap<>(DatasetCategory.class);
    private final List<String>             waiting   = new ArrayList<>();
    private final List<Removal>            removals  = new ArrayList<>();
    private final Map<String, RunningStep> running   = new LinkedHashMap<>();
    private final JobCounters              counters  = new JobCounters();
    private int updates;

    public FakePipelineInterface(String label, Bucket bucket) {
        this.label  = label;
        this.bucket = bucket;
        for (DatasetCategory c : DatasetCategory.values()) {
            produced.put(c, new TreeMap<>());
        }
    }

    public synchronized FakePipelineInterface produce(DatasetCategory category, String code, String name) {
        produced.get(category).put(code, name);
        return this;
    }

    public synchronized FakePipelineInterface enqueue(String stepName) {
        waiting.add(stepName);
        return this;
    }

    public synchronized FakePipelineInterface running(String stepName, RunningStep step) {
        running.put(stepName, step);
        return this;
    }

    @Override public String label()   { return label; }
    @Override public Bucket bucket()  { return bucket; }
    @Override public synchronized void update() { updates++; }

    @Override
    public synchronized SortedMap<String, String> listing(DatasetCategory category) {
        return Collections.unmodifiableSortedMap(new TreeMap<>(produced.get(category)));
    }

    @Override
    public synchronized Optional<String> locate(DatasetCategory category, String stepCode) {
        String name = produced.get(category).get(stepCode);
        return name == null ? Optional.empty() : Optional.of(stepCode + "_" + name);
    }

    @Override public synchronized List<String> waitingList() { return List.copyOf(waiting); }

    @Override
    public synchronized void destroyStep(String stepCode, RemoveMode mode) {
        removals.add(new Removal(stepCode, mode));
        produced.values().forEach(m -> m.remove(stepCode));
    }

    @Override public JobCounters jobCounters() { return counters; }

    @Override public InterfaceBuilder builder() { return new Builder(); }

    @Override public synchronized Map<String, RunningStep> runningSteps() { return Map.copyOf(running); }

    public synchronized List<Removal> removals() { return List.copyOf(removals); }

    public synchronized int updates() { return updates; }

    /** Records the authored step; {@code run()} stores it as processed output at once. */
    private class Builder implements InterfaceBuilder {

        private String title;
        private String stepCode;

        @Override
        public InterfaceBuilder initStep(String title, String stepCode) {
            this.title    = title;
            this.stepCode = stepCode;
            return this;
        }

        @Override public InterfaceBuilder setInput(String label, String sourceStepCode) { return this; }
        @Override public InterfaceBuilder setOutput(String label) { return this; }
        @Override public InterfaceBuilder setCommand(String command) { return this; }

        @Override
        public void run() {
            if (title == null) {
                throw new IllegalStateException("initStep must be called before run");
            }
            counters.submit(1);
            produce(DatasetCategory.PROCESSED, stepCode, title);
            counters.complete(1);
        }
    }
}

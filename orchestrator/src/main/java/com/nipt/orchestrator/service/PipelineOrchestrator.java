package com.nipt.orchestrator.service;

import com.nipt.orchestrator.bucket.Bucket;
import com.nipt.orchestrator.bucket.DatasetCategory;
import com.nipt.orchestrator.bucket.DatasetView;
import com.nipt.orchestrator.dataset.DatasetResolver;
import com.nipt.orchestrator.pipeline.EmptyPipeline;
import com.nipt.orchestrator.pipeline.ParameterBinder;
import com.nipt.orchestrator.pipeline.PipelineDefinition;
import com.nipt.orchestrator.pipeline.PipelineException;
import com.nipt.orchestrator.pipeline.PipelineStep;
import com.nipt.orchestrator.pipeline.StepRegistry;
import com.nipt.orchestrator.plugin.PackageCatalog;
import com.nipt.orchestrator.plugin.PipelinePackage;
import com.nipt.orchestrator.processing.InterfaceBuilder;
import com.nipt.orchestrator.processing.InterfaceOptions;
import com.nipt.orchestrator.processing.InterfaceProvider;
import com.nipt.orchestrator.processing.PipelineInterface;
import com.nipt.orchestrator.processing.RemoveMode;
import com.nipt.orchestrator.processing.StepCode;
import com.nipt.orchestrator.progress.ProgressSink;
import com.nipt.orchestrator.progress.ProgressTracker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for processing one dataset with the installed pipeline packages.
 *
 * <p>Typical use:
 * <pre>
 *   PipelineOrchestrator pipe = factory.create(Path.of("/project/dataset"));
 *   pipe.howto(0);                          // package documentation
 *   pipe.setPackage(0, Map.of());           // select and bind package 0
 *   pipe.run(0, Map.of("sigma", 2.0));      // run its first step
 *   pipe.checkProgression();                // follow the submitted jobs
 * </pre>
 *
 * <p>State has two axes. Selection: nothing is selected until
 * {@link #setPackage} or {@link #setEmptyPackage}, and {@link #detachPackage}
 * goes back. Binding: the selected package is instantiated against a freshly
 * opened pipeline interface by {@link #reset}, and again before every
 * {@link #run}. A new binding is fully built and configured before it replaces
 * the old one, so a rejected call never leaves a half-applied state.
 *
 * <p>All operations run on the caller's thread; {@link #run} blocks for the
 * whole step. The only background activity is a {@link ProgressTracker}.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String NO_SELECTION = "No pipeline package selected.";

    private final Bucket            bucket;
    private final PackageCatalog    catalog;
    private final InterfaceProvider interfaceProvider;
    private final InterfaceOptions  interfaceOptions;
    private final boolean           verbose;
    private final ProgressSink      progressSink;
    private final Duration          progressInterval;
    private final MeterRegistry     meterRegistry;

    // Null index with a non-null title means an empty (ad-hoc) package.
    private Integer selectedIndex;
    private String  pipelineTitle;
    private Binding binding;

    private final Object runLock = new Object();

    private record Binding(PipelineInterface  pipelineInterface,
                           PipelineDefinition definition,
                           StepRegistry       steps,
                           ParameterBinder    parameters) {}

    public PipelineOrchestrator(Bucket bucket,
                                PackageCatalog catalog,
                                InterfaceProvider interfaceProvider,
                                InterfaceOptions interfaceOptions,
                                boolean verbose,
                                ProgressSink progressSink,
                                Duration progressInterval,
                                MeterRegistry meterRegistry) {
        this.bucket            = bucket;
        this.catalog           = catalog;
        this.interfaceProvider = interfaceProvider;
        this.interfaceOptions  = interfaceOptions;
        this.verbose           = verbose;
        this.progressSink      = progressSink;
        this.progressInterval  = progressInterval;
        this.meterRegistry     = meterRegistry;

        report("Dataset summary:\n{}", bucket.summary());
        report("Installed pipeline packages:\n{}", listing(catalog.installed()));
    }

    // ------------------------------------------------------------------
    // Package selection
    // ------------------------------------------------------------------

    /** Titles of the installed packages keyed by index. */
    public SortedMap<Integer, String> installedPackages() {
        return catalog.installed();
    }

    /**
     * Select the installed package at {@code index} and bind it with {@code params}.
     *
     * @throws PipelineException INVALID_PACKAGE_IDENTIFIER if no package has that index,
     *                           UNKNOWN_PARAMETER_NAME / INVALID_PARAMETER_VALUE for bad params
     */
    public synchronized void setPackage(int index, Map<String, ?> params) {
        PipelinePackage pkg = catalog.get(index).orElseThrow(() ->
                new PipelineException(PipelineException.Kind.INVALID_PACKAGE_IDENTIFIER,
                        "No installed pipeline package at index " + index
                                + " (installed: " + catalog.installed() + ")"));
        bucket.update();

        String title = pkg.manifest().title();
        Binding fresh = bind(title, pkg, params);
        selectedIndex = index;
        pipelineTitle = title;
        binding       = fresh;

        report("Pipeline package '{}' selected: {}", title, pkg.manifest().description());
        report("Available steps in '{}':\n{}", title, listing(fresh.steps().names()));
    }

    public void setPackage(int index) {
        setPackage(index, Map.of());
    }

    /**
     * Bind an ad-hoc package with no steps and no parameters under {@code title},
     * without consulting the installed packages.
     */
    public synchronized void setEmptyPackage(String title) {
        if (title == null || title.isBlank()) {
            throw new PipelineException(PipelineException.Kind.INVALID_PACKAGE_IDENTIFIER,
                    "An empty package needs a title");
        }
        bucket.update();
        Binding fresh = bind(title, null, Map.of());
        selectedIndex = null;
        pipelineTitle = title;
        binding       = fresh;
        report("Temporary pipeline package [{}] is initiated", title);
    }

    public synchronized void detachPackage() {
        selectedIndex = null;
        pipelineTitle = null;
        binding       = null;
    }

    /** Title of the current selection, if any. */
    public synchronized Optional<String> selectedTitle() {
        return Optional.ofNullable(pipelineTitle);
    }

    /**
     * Rebind the current selection to a new pipeline interface with default parameters,
     * then apply {@code params}. Does nothing when no package is selected.
     */
    public synchronized void reset(Map<String, ?> params) {
        if (pipelineTitle == null) {
            return;
        }
        binding = rebind(params);
    }

    public void reset() {
        reset(Map.of());
    }

    // ------------------------------------------------------------------
    // Parameters
    // ------------------------------------------------------------------

    /**
     * @throws PipelineException NO_PACKAGE_SELECTED, UNKNOWN_PARAMETER_NAME or INVALID_PARAMETER_VALUE
     */
    public synchronized void setParam(Map<String, ?> params) {
        requireBinding().parameters().setAll(params);
    }

    /** Current parameter values, or empty when nothing is selected. */
    public synchronized Optional<Map<String, Object>> getParam() {
        return binding == null ? Optional.empty() : Optional.of(binding.parameters().getAll());
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    /** Step names of the current selection keyed by index. */
    public synchronized SortedMap<Integer, String> installedPipelines() {
        return requireBinding().steps().names();
    }

    public synchronized List<PipelineStep> steps() {
        return requireBinding().steps().steps();
    }

    /**
     * Rebind the selection with default parameters, apply {@code params}, and run the
     * step at {@code stepIndex} on the calling thread.
     *
     * <p>Only the rebind holds the orchestrator's monitor; the step itself runs outside
     * it, so summaries, parameters and progress stay readable while it works. Runs are
     * serialized with each other.
     *
     * @throws PipelineException NO_PACKAGE_SELECTED, UNKNOWN_STEP_INDEX or a parameter kind;
     *                           exceptions thrown by the step itself propagate unchanged
     */
    public void run(int stepIndex, Map<String, ?> params) {
        synchronized (runLock) {
            Binding fresh;
            String title;
            PipelineStep step;
            synchronized (this) {
                requireBinding();
                fresh = rebind(params);
                step  = fresh.steps().step(stepIndex);
                title = pipelineTitle;
                binding = fresh;
            }

            report("Running step {} '{}': {}", stepIndex, step.name(), step.description());
            MDC.put("pipeline",  title);
            MDC.put("step",      step.name());
            MDC.put("stepIndex", String.valueOf(stepIndex));
            try {
                fresh.steps().invoke(stepIndex);
            } finally {
                MDC.remove("pipeline");
                MDC.remove("step");
                MDC.remove("stepIndex");
            }
        }
    }

    public void run(int stepIndex) {
        run(stepIndex, Map.of());
    }

    // ------------------------------------------------------------------
    // Documentation
    // ------------------------------------------------------------------

    public Optional<String> howto(int index) {
        return catalog.get(index).map(p -> p.manifest().description());
    }

    public Optional<String> howto(String title) {
        return catalog.find(title).map(p -> p.manifest().description());
    }

    // ------------------------------------------------------------------
    // Produced data
    // ------------------------------------------------------------------

    /**
     * Destroy the stored output of one step code.
     *
     * @throws PipelineException MALFORMED_STEP_CODE unless the code has exactly 3 characters,
     *                           NO_PACKAGE_SELECTED when no interface is bound
     */
    public synchronized void remove(String stepCode, RemoveMode mode) {
        remove(List.of(StepCode.of(stepCode).value()), mode);
    }

    /** Every code is validated before any is destroyed. */
    public synchronized void remove(List<String> stepCodes, RemoveMode mode) {
        List<StepCode> codes = StepCode.allOf(stepCodes);
        PipelineInterface pipelineInterface = requireBinding().pipelineInterface();
        RemoveMode effective = mode != null ? mode : RemoveMode.PROCESSING;
        for (StepCode code : codes) {
            log.info("Removing {} output of step {} from '{}'", effective, code, pipelineTitle);
            pipelineInterface.destroyStep(code.value(), effective);
        }
    }

    public Optional<DatasetView> getDset(String stepCode) {
        return getDset(stepCode, DatasetResolver.DEFAULT_EXTENSION, null);
    }

    /**
     * Files stored for {@code stepCode}, looked up in processed steps, then reports, then masks.
     * Empty when nothing is selected or no namespace holds the code.
     */
    public synchronized Optional<DatasetView> getDset(String stepCode, String ext, String regex) {
        if (binding == null) {
            return Optional.empty();
        }
        PipelineInterface pipelineInterface = binding.pipelineInterface();
        pipelineInterface.update();
        return new DatasetResolver(pipelineInterface)
                .resolve(stepCode, ext, regex)
                .map(r -> bucket.query(r.category(), r.filter()));
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    /** Start following the bound interface's job counters; empty when nothing is bound. */
    public synchronized Optional<ProgressTracker> checkProgression() {
        if (binding == null) {
            return Optional.empty();
        }
        ProgressTracker tracker = new ProgressTracker(pipelineTitle,
                binding.pipelineInterface().jobCounters(), progressSink, progressInterval);
        return Optional.of(tracker.start());
    }

    // ------------------------------------------------------------------
    // Read-only views
    // ------------------------------------------------------------------

    public Bucket bucket() { return bucket; }

    /** Builder for authoring steps against the bound interface; empty when nothing is bound. */
    public synchronized Optional<InterfaceBuilder> getBuilder() {
        return binding == null ? Optional.empty() : Optional.of(binding.pipelineInterface().builder());
    }

    public synchronized Optional<PipelineInterface> pipelineInterface() {
        return binding == null ? Optional.empty() : Optional.of(binding.pipelineInterface());
    }

    public synchronized Map<String, List<Thread>> schedulers() {
        Map<String, List<Thread>> out = new LinkedHashMap<>();
        requireBinding().pipelineInterface().runningSteps()
                .forEach((name, running) -> out.put(name, running.schedulers()));
        return out;
    }

    public synchronized Map<String, List<ExecutorService>> managers() {
        Map<String, List<ExecutorService>> out = new LinkedHashMap<>();
        requireBinding().pipelineInterface().runningSteps()
                .forEach((name, running) -> out.put(name, running.managers()));
        return out;
    }

    /** Produced and queued steps of the current selection; empty when nothing is selected. */
    public synchronized Optional<String> summary() {
        if (binding == null) {
            return Optional.empty();
        }
        PipelineInterface pipelineInterface = binding.pipelineInterface();
        pipelineInterface.update();

        List<String> lines = new ArrayList<>();
        lines.add("** List of existing steps in selected package [" + pipelineTitle + "]:\n");
        for (DatasetCategory category : DatasetCategory.values()) {
            SortedMap<String, String> produced = pipelineInterface.listing(category);
            if (!produced.isEmpty()) {
                lines.add("- " + category.heading() + ":");
                produced.forEach((code, name) -> lines.add("\t" + code + ": " + name));
            }
        }
        List<String> waiting = pipelineInterface.waitingList();
        if (!waiting.isEmpty()) {
            lines.add("- Queue:");
            lines.add("\t" + String.join(", ", waiting));
        }
        return Optional.of(String.join("\n", lines));
    }

    @Override
    public String toString() {
        return summary().orElse(NO_SELECTION);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Binding requireBinding() {
        if (binding == null) {
            throw PipelineException.noPackageSelected();
        }
        return binding;
    }

    /** Build a new binding for the current selection; the caller decides whether to keep it. */
    private Binding rebind(Map<String, ?> params) {
        PipelinePackage pkg = null;
        if (selectedIndex != null) {
            pkg = catalog.get(selectedIndex).orElseThrow(() ->
                    new IllegalStateException("Installed package " + selectedIndex + " disappeared"));
        }
        return bind(pipelineTitle, pkg, params);
    }

    /**
     * Open an interface under {@code title}, instantiate the package against it
     * (an {@link EmptyPipeline} when {@code pkg} is null) and apply {@code params}
     * over its defaults.
     */
    private Binding bind(String title, PipelinePackage pkg, Map<String, ?> params) {
        PipelineInterface pipelineInterface = interfaceProvider.open(bucket, title, interfaceOptions);
        PipelineDefinition definition = pkg != null
                ? pkg.create(pipelineInterface)
                : new EmptyPipeline(pipelineInterface);

        ParameterBinder parameters = ParameterBinder.of(definition);
        parameters.setAll(params);
        return new Binding(pipelineInterface, definition, StepRegistry.of(definition, meterRegistry), parameters);
    }

    private void report(String format, Object... args) {
        if (verbose) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static String listing(Map<Integer, String> entries) {
        StringBuilder sb = new StringBuilder();
        entries.forEach((i, name) -> sb.append('\t').append(i).append(" : ").append(name).append('\n'));
        return sb.toString().stripTrailing();
    }
}

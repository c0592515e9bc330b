package com.nipt.orchestrator.pipeline;

import com.nipt.orchestrator.processing.PipelineInterface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of every pipeline a plugin package provides.
 *
 * <p>A subclass declares its configuration with {@link #parameter} and its steps
 * with {@link #registerStep}, normally from its constructor:
 * <pre>
 *   public T1Pipeline(PipelineInterface iface) {
 *       super(iface);
 *       registerStep("denoise", "Non-local means denoising", this::denoise);
 *   }
 *   private final Parameter&lt;Double&gt; sigma = parameter("sigma", Double.class, 1.0);
 * </pre>
 * Steps receive their index in registration order. One instance is bound to
 * one pipeline interface; the orchestrator creates a fresh instance on every rebind.
 */
public abstract class PipelineDefinition {

    static final Set<String> RESERVED_NAMES = Set.of("installed_pipelines", "interface");

    private static final String STEP_PREFIX = "pipe_";

    private final PipelineInterface             pipelineInterface;
    private final List<PipelineStep>            steps      = new ArrayList<>();
    private final Map<String, Parameter<?>>     parameters = new LinkedHashMap<>();

    protected PipelineDefinition(PipelineInterface pipelineInterface) {
        this.pipelineInterface = Objects.requireNonNull(pipelineInterface, "pipelineInterface");
    }

    public PipelineInterface pipelineInterface() { return pipelineInterface; }

    /** Title of the package this definition is bound under. */
    public String title() { return pipelineInterface.label(); }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    protected final void registerStep(String name, String description, Runnable action) {
        requireName(name, "step");
        Objects.requireNonNull(action, "action");
        if (steps.stream().anyMatch(s -> s.name().equals(name))) {
            throw new IllegalArgumentException("Step '" + name + "' is already registered");
        }
        steps.add(new PipelineStep(steps.size(), name, description == null ? "" : description, action));
    }

    protected final <T> Parameter<T> parameter(String name, Class<T> type, T defaultValue) {
        return parameter(name, type, defaultValue, "");
    }

    protected final <T> Parameter<T> parameter(String name, Class<T> type, T defaultValue, String description) {
        requireName(name, "parameter");
        Objects.requireNonNull(type, "type");
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("Parameter '" + name + "' must use a boxed type, not " + type);
        }
        if (RESERVED_NAMES.contains(name) || name.startsWith("_") || name.startsWith(STEP_PREFIX)) {
            throw new IllegalArgumentException("Parameter name '" + name + "' is reserved");
        }
        if (parameters.containsKey(name)) {
            throw new IllegalArgumentException("Parameter '" + name + "' is already declared");
        }
        Parameter<T> parameter = new Parameter<>(name, type, defaultValue, description);
        parameters.put(name, parameter);
        return parameter;
    }

    List<PipelineStep> declaredSteps() {
        return List.copyOf(steps);
    }

    Map<String, Parameter<?>> declaredParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A " + what + " name must not be blank");
        }
    }
}

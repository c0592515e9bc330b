package com.nipt.orchestrator.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Get/set access to the parameters a pipeline definition declared.
 *
 * Only declared names can be read or written; nothing can be added.
 * {@link #setAll} converts and validates every entry before assigning any,
 * so a rejected call leaves all values untouched.
 */
public class ParameterBinder {

    private final String                    pipeline;
    private final Map<String, Parameter<?>> parameters;

    private ParameterBinder(String pipeline, Map<String, Parameter<?>> parameters) {
        this.pipeline   = pipeline;
        this.parameters = parameters;
    }

    public static ParameterBinder of(PipelineDefinition definition) {
        return new ParameterBinder(definition.title(), definition.declaredParameters());
    }

    /** Current value of every declared parameter, in declaration order. */
    public Map<String, Object> getAll() {
        Map<String, Object> values = new LinkedHashMap<>();
        parameters.forEach((name, p) -> values.put(name, p.get()));
        return Collections.unmodifiableMap(values);
    }

    public Object get(String name) {
        return lookup(name).get();
    }

    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    public void set(String name, Object value) {
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(name, value);
        setAll(single);
    }

    public void setAll(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        Map<Parameter<?>, Object> converted = new LinkedHashMap<>();
        values.forEach((name, raw) -> {
            Parameter<?> parameter = lookup(name);
            converted.put(parameter, parameter.convert(raw));
        });
        converted.forEach(Parameter::assign);
    }

    private Parameter<?> lookup(String name) {
        Parameter<?> parameter = parameters.get(name);
        if (parameter == null) {
            throw new PipelineException(PipelineException.Kind.UNKNOWN_PARAMETER_NAME,
                    "Pipeline '%s' has no parameter '%s' (known: %s)"
                            .formatted(pipeline, name, parameters.keySet()));
        }
        return parameter;
    }
}

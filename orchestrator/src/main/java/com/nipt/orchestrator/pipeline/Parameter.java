package com.nipt.orchestrator.pipeline;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed configuration field declared by a pipeline definition.
 *
 * Definitions keep the handle returned by {@code parameter(...)} and read it
 * with {@link #get()} when a step runs. Values arriving from outside go through
 * {@link #convert(Object)} so a JSON number or string can fill an Integer, Double,
 * Path or enum field.
 */
public final class Parameter<T> {

    private final String   name;
    private final Class<T> type;
    private final T        defaultValue;
    private final String   description;

    private volatile T value;

    Parameter(String name, Class<T> type, T defaultValue, String description) {
        this.name         = name;
        this.type         = type;
        this.defaultValue = defaultValue;
        this.description  = description;
        this.value        = defaultValue;
    }

    public String   name()         { return name; }
    public Class<T> type()         { return type; }
    public T        defaultValue() { return defaultValue; }
    public String   description()  { return description; }
    public T        get()          { return value; }

    void assign(Object converted) {
        this.value = type.cast(converted);
    }

    /**
     * Convert an incoming value to this parameter's type.
     *
     * @throws PipelineException of kind INVALID_PARAMETER_VALUE when no exact conversion exists
     */
    T convert(Object raw) {
        if (raw == null || type.isInstance(raw)) {
            return type.cast(raw);
        }
        try {
            if (raw instanceof Number n) {
                T number = convertNumber(n);
                if (number != null) return number;
            } else if (raw instanceof String s) {
                if (type == Path.class) return type.cast(Path.of(s));
                if (type.isEnum())      return toEnum(s);
            }
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw invalid(raw, e);
        }
        throw invalid(raw, null);
    }

    private T convertNumber(Number n) {
        BigDecimal exact = exactValue(n);
        if (type == Integer.class) return type.cast(exact.intValueExact());
        if (type == Long.class)    return type.cast(exact.longValueExact());
        if (type == Double.class)  return type.cast(requireExact(exact, n.doubleValue()));
        if (type == Float.class)   return type.cast(requireExact(exact, n.floatValue()));
        return null;
    }

    // Binary value for floating-point sources, decimal text for everything else.
    private static BigDecimal exactValue(Number n) {
        return n instanceof Double || n instanceof Float
                ? new BigDecimal(n.doubleValue())
                : new BigDecimal(n.toString());
    }

    private static <N extends Number> N requireExact(BigDecimal exact, N converted) {
        if (exact.compareTo(new BigDecimal(converted.doubleValue())) != 0) {
            throw new ArithmeticException("precision lost converting " + exact.toPlainString());
        }
        return converted;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private T toEnum(String s) {
        return (T) Enum.valueOf((Class) type, s.strip().toUpperCase(Locale.ROOT));
    }

    private PipelineException invalid(Object raw, Throwable cause) {
        String message = "Parameter '%s' expects %s, got %s '%s'".formatted(
                name, type.getSimpleName(), raw.getClass().getSimpleName(), raw);
        return cause == null
                ? new PipelineException(PipelineException.Kind.INVALID_PARAMETER_VALUE, message)
                : new PipelineException(PipelineException.Kind.INVALID_PARAMETER_VALUE, message, cause);
    }

    @Override
    public String toString() {
        return name + "=" + Objects.toString(value);
    }
}

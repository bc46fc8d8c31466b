package com.questrail.pvstream.processing;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative description of one pipeline stage.
 *
 * @param name    label used in logs and failure events
 * @param type    registry key of the processor factory, e.g. {@code invert}
 * @param enabled disabled stages are not instantiated
 * @param params  factory-specific string parameters
 */
public record ProcessorSpec(String name, String type, boolean enabled, Map<String, String> params) {

    public ProcessorSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        params = Map.copyOf(Objects.requireNonNull(params, "params"));
    }

    public static ProcessorSpec of(String name, String type) {
        return new ProcessorSpec(name, type, true, Map.of());
    }

    public Optional<String> param(String key) {
        return Optional.ofNullable(params.get(key));
    }

    public boolean booleanParam(String key, boolean defaultValue) {
        return param(key).map(v -> Boolean.parseBoolean(v.trim())).orElse(defaultValue);
    }
}

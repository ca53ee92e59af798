package com.credit.modelengine.engine;

import java.util.List;
import java.util.Objects;

/**
 * Declarative definition of a derived metric.
 *
 * @param key         unique metric key.
 * @param dependsOn   declared dependencies; metric keys among them become graph edges.
 * @param formula     the formula computing the metric.
 * @param description human-readable description, may be {@code null}.
 */
public record MetricDefinition(String key, List<String> dependsOn, Formula formula, String description) {

    public MetricDefinition {
        if (key == null || key.isBlank())
            throw new IllegalArgumentException("Metric key is required");
        Objects.requireNonNull(formula, "formula of " + key);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static MetricDefinition of(String key, Formula formula, String... dependsOn) {
        return new MetricDefinition(key, List.of(dependsOn), formula, null);
    }
}

package com.credit.modelengine.engine;

import java.util.List;

/**
 * Raised when metric definitions form a dependency cycle. A cyclic graph has no
 * evaluation order, so evaluation is aborted as a whole.
 */
public class MetricCycleException extends IllegalStateException {
    private final String metricKey;
    private final List<String> unresolved;

    public MetricCycleException(String metricKey, List<String> unresolved) {
        super("Cycle detected at metric '" + metricKey + "'; unresolved metrics: " + unresolved);
        this.metricKey = metricKey;
        this.unresolved = List.copyOf(unresolved);
    }

    /** A metric on the cycle, the earliest such in definition order. */
    public String metricKey() {
        return metricKey;
    }

    public List<String> unresolved() {
        return unresolved;
    }
}

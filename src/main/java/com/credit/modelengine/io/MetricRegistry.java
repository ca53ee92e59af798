package com.credit.modelengine.io;

import java.util.List;
import java.util.Optional;

import com.credit.modelengine.engine.MetricDefinition;

/**
 * A named, versioned set of metric definitions. The version is stamped on every
 * snapshot so that replays can detect registry drift.
 */
public record MetricRegistry(String name, String version, List<MetricDefinition> metrics) {

    public MetricRegistry {
        metrics = List.copyOf(metrics);
    }

    public Optional<MetricDefinition> metric(String key) {
        return metrics.stream().filter(m -> m.key().equals(key)).findFirst();
    }

    public int size() {
        return metrics.size();
    }
}

package com.credit.modelengine.parity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Parity metrics of one period, the shape both adapters produce. A metric that
 * a side does not report is absent from the map, never zero.
 *
 * @param periodEnd ISO end date used for alignment.
 * @param label     display label of the period on its own side, may be null.
 * @param metrics   reported values.
 */
public record PeriodMetrics(String periodEnd, String label, Map<ParityMetric, Double> metrics) {

    public PeriodMetrics {
        EnumMap<ParityMetric, Double> copy = new EnumMap<>(ParityMetric.class);
        copy.putAll(metrics);
        metrics = Collections.unmodifiableMap(copy);
    }

    public Double get(ParityMetric metric) {
        return metrics.get(metric);
    }

    public boolean has(ParityMetric metric) {
        return metrics.get(metric) != null;
    }
}

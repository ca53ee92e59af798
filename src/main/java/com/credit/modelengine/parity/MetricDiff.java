package com.credit.modelengine.parity;

/**
 * Difference of one metric in one aligned period. {@code delta = right - left}.
 */
public record MetricDiff(
        ParityMetric metric,
        String periodEnd,
        double left,
        double right,
        double delta,
        double pctDelta,
        boolean material,
        DiffLevel level) {
}

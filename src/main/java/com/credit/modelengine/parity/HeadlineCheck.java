package com.credit.modelengine.parity;

/**
 * Tolerance check of a headline metric in one aligned period. A value missing
 * on either side is a coverage gap, reported as within tolerance; it surfaces
 * as a missing-row flag instead.
 */
public record HeadlineCheck(
        ParityMetric metric,
        String periodEnd,
        Double left,
        Double right,
        Double delta,
        Double pctDelta,
        boolean withinTolerance) {
}

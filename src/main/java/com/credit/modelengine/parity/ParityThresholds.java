package com.credit.modelengine.parity;

/**
 * Parity tolerances.
 *
 * @param incomeStatement      levels for income statement metrics.
 * @param balanceSheet         levels for balance sheet metrics.
 * @param derived              levels for derived ratios.
 * @param headlineAbsTolerance absolute tolerance of a headline metric.
 * @param headlinePctTolerance relative tolerance of a headline metric.
 * @param missingPeriodFails   whether a period missing on the model side fails the report.
 */
public record ParityThresholds(
        CategoryThreshold incomeStatement,
        CategoryThreshold balanceSheet,
        CategoryThreshold derived,
        double headlineAbsTolerance,
        double headlinePctTolerance,
        boolean missingPeriodFails) {

    public static final ParityThresholds DEFAULT = new ParityThresholds(
            new CategoryThreshold(1.0, 0.001, 1000.0, 0.01),
            new CategoryThreshold(1.0, 0.001, 1000.0, 0.01),
            new CategoryThreshold(0.01, 0.001, 0.1, 0.01),
            1.0, 0.0001, true);

    /** Looser preset for deals with known rounding in the legacy rendering. */
    public static final ParityThresholds RELAXED = new ParityThresholds(
            new CategoryThreshold(100.0, 0.005, 10_000.0, 0.05),
            new CategoryThreshold(100.0, 0.005, 10_000.0, 0.05),
            new CategoryThreshold(0.05, 0.005, 0.5, 0.05),
            100.0, 0.005, false);

    public CategoryThreshold forCategory(MetricCategory category) {
        return switch (category) {
            case INCOME_STATEMENT -> incomeStatement;
            case BALANCE_SHEET -> balanceSheet;
            case DERIVED -> derived;
        };
    }
}

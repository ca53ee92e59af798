package com.credit.modelengine.engine;

/**
 * Observability hook for metric graph evaluation.
 *
 * Callbacks run inline with evaluation; implementations must be cheap and must
 * not throw.
 */
public interface EvaluationListener {

    /**
     * Called before the first metric is evaluated.
     *
     * @param metricCount number of metrics in topological order.
     */
    void onEvaluationStart(int metricCount);

    /** Called after a metric produced a value (possibly {@code null}). */
    void onMetricEvaluated(int topoIndex, String metricKey, Double value);

    /** Called when a metric resolved to null for a diagnosable reason. */
    void onMetricFailed(int topoIndex, EvaluationDiagnostic diagnostic);

    /**
     * Called when every metric has been visited.
     *
     * @param evaluated number of metrics that produced a non-null value.
     */
    void onEvaluationEnd(int evaluated);
}

package com.credit.modelengine.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.credit.modelengine.engine.DiagnosticCode;
import com.credit.modelengine.engine.EvaluationDiagnostic;
import com.credit.modelengine.engine.EvaluationListener;

/**
 * Listener that tallies null metrics by reason and logs a one-line summary per
 * evaluation.
 *
 * <p>
 * Instances are per computation; they are not safe to share between threads.
 */
public final class DiagnosticsTrackingListener implements EvaluationListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(DiagnosticsTrackingListener.class);

    private final String context;
    private final Map<DiagnosticCode, Integer> counts = new EnumMap<>(DiagnosticCode.class);
    private final List<EvaluationDiagnostic> diagnostics = new ArrayList<>();
    private int metricCount;
    private int lastEvaluated;

    public DiagnosticsTrackingListener(String context) {
        this.context = context;
    }

    @Override
    public void onEvaluationStart(int metricCount) {
        this.metricCount = metricCount;
        counts.clear();
        diagnostics.clear();
    }

    @Override
    public void onMetricEvaluated(int topoIndex, String metricKey, Double value) {
        // values are reported through the evaluator result
    }

    @Override
    public void onMetricFailed(int topoIndex, EvaluationDiagnostic diagnostic) {
        counts.merge(diagnostic.code(), 1, Integer::sum);
        diagnostics.add(diagnostic);
        log.debug("[{}] {}", context, diagnostic.message());
    }

    @Override
    public void onEvaluationEnd(int evaluated) {
        lastEvaluated = evaluated;
        if (diagnostics.isEmpty())
            log.debug("[{}] {} metrics evaluated", context, metricCount);
        else
            log.info("[{}] {}/{} metrics evaluated, null by reason: {}", context, evaluated, metricCount, counts);
    }

    public int count(DiagnosticCode code) {
        return counts.getOrDefault(code, 0);
    }

    public List<EvaluationDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int lastEvaluated() {
        return lastEvaluated;
    }

    public int metricCount() {
        return metricCount;
    }
}

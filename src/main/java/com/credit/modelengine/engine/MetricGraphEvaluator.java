package com.credit.modelengine.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates declarative metric definitions over a base value set.
 *
 * Algorithm:
 * 1. Sort: metrics are ordered with {@link MetricTopology}; a cycle aborts the
 * whole evaluation with {@link MetricCycleException}.
 * 2. Seed: base values are copied into the working value map.
 * 3. Evaluate: each metric is computed once, in topological order, and its
 * result is inserted into the value map before dependents read it.
 *
 * Null semantics:
 * A missing or null operand makes the metric null, never zero. Division by a
 * resolved zero is null, never infinity. Non-finite arithmetic results are
 * null as well. One metric failing never prevents its siblings from being
 * computed.
 *
 * The plain, diagnostics and audit variants share a single evaluation pass, so
 * their values are identical for identical inputs.
 */
public final class MetricGraphEvaluator {
    private static final Logger log = LogManager.getLogger(MetricGraphEvaluator.class);

    private EvaluationListener listener;

    public void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    /** Values computed together with one diagnostic per failing metric. */
    public record DiagnosticResult(Map<String, Double> values, List<EvaluationDiagnostic> diagnostics) {
    }

    /** Values computed together with the realized dependency list of every metric. */
    public record AuditResult(Map<String, Double> values, Map<String, List<String>> dependencyGraph) {
    }

    /**
     * Orders metrics so that every metric follows the metrics it depends on.
     *
     * @throws MetricCycleException if the definitions contain a cycle.
     */
    public static List<MetricDefinition> sort(List<MetricDefinition> metrics) {
        return MetricTopology.of(metrics).ordered();
    }

    /**
     * Evaluates every metric. The result holds the base values followed by the
     * computed metrics; a metric that could not be computed maps to {@code null}.
     */
    public Map<String, Double> evaluate(List<MetricDefinition> metrics, Map<String, Double> baseValues) {
        return run(metrics, baseValues, null, null);
    }

    public DiagnosticResult evaluateWithDiagnostics(List<MetricDefinition> metrics, Map<String, Double> baseValues) {
        List<EvaluationDiagnostic> diagnostics = new ArrayList<>();
        Map<String, Double> values = run(metrics, baseValues, diagnostics, null);
        return new DiagnosticResult(values, Collections.unmodifiableList(diagnostics));
    }

    public AuditResult evaluateWithAudit(List<MetricDefinition> metrics, Map<String, Double> baseValues) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        Map<String, Double> values = run(metrics, baseValues, null, graph);
        return new AuditResult(values, Collections.unmodifiableMap(graph));
    }

    /**
     * Evaluates a single formula against a value map.
     *
     * @return the value, or {@code null} if an operand is missing or the
     *         arithmetic is undefined.
     */
    public static Double evaluateFormula(Formula formula, Map<String, Double> values) {
        return evaluateFormula(formula, values, null).value();
    }

    /** Outcome of one formula evaluation. {@code diagnostic} is set whenever value is null. */
    public record FormulaResult(Double value, DiagnosticCode code, String operand) {
        public EvaluationDiagnostic diagnostic(String metricKey) {
            if (code == null)
                return null;
            String message = switch (code) {
                case MISSING_DEPENDENCY -> "Metric " + metricKey + ": operand '" + operand + "' is missing";
                case DIVIDE_BY_ZERO -> "Metric " + metricKey + ": divisor '" + operand + "' is zero";
                case INVALID_OP -> "Metric " + metricKey + ": operation on '" + operand + "' is not finite";
            };
            return new EvaluationDiagnostic(metricKey, code, operand, message);
        }
    }

    static FormulaResult evaluateFormula(Formula formula, Map<String, Double> values, List<String> reads) {
        Double left = resolve(formula.left(), values, reads);
        Double right = resolve(formula.right(), values, reads);
        if (left == null)
            return new FormulaResult(null, DiagnosticCode.MISSING_DEPENDENCY, formula.left());
        if (right == null)
            return new FormulaResult(null, DiagnosticCode.MISSING_DEPENDENCY, formula.right());

        if (formula.op() == FormulaOp.DIVIDE && right == 0.0)
            return new FormulaResult(null, DiagnosticCode.DIVIDE_BY_ZERO, formula.right());

        double result = switch (formula.op()) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
        };
        if (!Double.isFinite(result))
            return new FormulaResult(null, DiagnosticCode.INVALID_OP, formula.left());
        return new FormulaResult(result, null, null);
    }

    private static Double resolve(String operand, Map<String, Double> values, List<String> reads) {
        Double literal = Formula.literal(operand);
        if (literal != null)
            return literal;
        if (reads != null && !reads.contains(operand))
            reads.add(operand);
        return values.get(operand);
    }

    private Map<String, Double> run(List<MetricDefinition> metrics, Map<String, Double> baseValues,
            List<EvaluationDiagnostic> diagnostics, Map<String, List<String>> dependencyGraph) {
        MetricTopology topology = MetricTopology.of(metrics);
        Map<String, Double> values = new LinkedHashMap<>(baseValues);
        final EvaluationListener l = this.listener;
        final int n = topology.metricCount();

        if (l != null)
            l.onEvaluationStart(n);

        int evaluated = 0;
        for (int ti = 0; ti < n; ti++) {
            MetricDefinition metric = topology.metric(ti);
            List<String> reads = dependencyGraph != null ? new ArrayList<>(2) : null;
            FormulaResult result = evaluateFormula(metric.formula(), values, reads);
            values.put(metric.key(), result.value());

            if (dependencyGraph != null)
                dependencyGraph.put(metric.key(), Collections.unmodifiableList(reads));
            if (result.value() != null) {
                evaluated++;
            } else {
                EvaluationDiagnostic diagnostic = result.diagnostic(metric.key());
                if (diagnostics != null)
                    diagnostics.add(diagnostic);
                if (l != null)
                    l.onMetricFailed(ti, diagnostic);
            }
            if (l != null)
                l.onMetricEvaluated(ti, metric.key(), result.value());
        }

        if (l != null)
            l.onEvaluationEnd(evaluated);
        log.debug("Evaluated {} metrics, {} non-null", n, evaluated);
        return values;
    }
}

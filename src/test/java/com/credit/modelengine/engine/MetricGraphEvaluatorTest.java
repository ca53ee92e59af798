package com.credit.modelengine.engine;

import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class MetricGraphEvaluatorTest {

    private final MetricGraphEvaluator evaluator = new MetricGraphEvaluator();

    private static final List<MetricDefinition> METRICS = List.of(
            MetricDefinition.of("DSCR", Formula.of("divide", "CFADS", "DEBT_SERVICE"), "CFADS", "DEBT_SERVICE"),
            MetricDefinition.of("CFADS_STRESSED", Formula.of("multiply", "CFADS", "0.9"), "CFADS"),
            MetricDefinition.of("DSCR_STRESSED", Formula.of("divide", "CFADS_STRESSED", "DEBT_SERVICE"),
                    "CFADS_STRESSED", "DEBT_SERVICE"),
            MetricDefinition.of("NET_MARGIN", Formula.of("divide", "NET_INCOME", "REVENUE"), "NET_INCOME",
                    "REVENUE"));

    private static Map<String, Double> base(Object... kv) {
        Map<String, Double> m = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2)
            m.put((String) kv[i], kv[i + 1] == null ? null : ((Number) kv[i + 1]).doubleValue());
        return m;
    }

    @Test
    public void testDependentsEvaluatedInOrder() {
        Map<String, Double> values = evaluator.evaluate(METRICS,
                base("CFADS", 1000, "DEBT_SERVICE", 500, "NET_INCOME", 50, "REVENUE", 1000));

        assertEquals(2.0, values.get("DSCR"), 1e-12);
        assertEquals(900.0, values.get("CFADS_STRESSED"), 1e-9);
        assertEquals(1.8, values.get("DSCR_STRESSED"), 1e-12);
        assertEquals(0.05, values.get("NET_MARGIN"), 1e-12);
        // base values are carried through
        assertEquals(1000.0, values.get("CFADS"), 0.0);
    }

    @Test
    public void testMissingOperandYieldsNull() {
        Map<String, Double> values = evaluator.evaluate(METRICS, base("CFADS", 1000, "DEBT_SERVICE", 500));

        assertTrue(values.containsKey("NET_MARGIN"));
        assertNull(values.get("NET_MARGIN"));
        // sibling metrics still computed
        assertEquals(2.0, values.get("DSCR"), 1e-12);
    }

    @Test
    public void testNullPropagatesThroughDependents() {
        Map<String, Double> values = evaluator.evaluate(METRICS, base("DEBT_SERVICE", 500));
        assertNull(values.get("CFADS_STRESSED"));
        assertNull(values.get("DSCR_STRESSED"));
    }

    @Test
    public void testDivideByZeroYieldsNull() {
        Map<String, Double> values = evaluator.evaluate(METRICS, base("CFADS", 1000, "DEBT_SERVICE", 0));
        assertNull(values.get("DSCR"));
        assertNull(values.get("DSCR_STRESSED"));
        assertEquals(900.0, values.get("CFADS_STRESSED"), 1e-9);
    }

    @Test
    public void testDiagnosticsNameMetricAndOperand() {
        MetricGraphEvaluator.DiagnosticResult result = evaluator.evaluateWithDiagnostics(METRICS,
                base("CFADS", 1000, "DEBT_SERVICE", 0, "NET_INCOME", 50));

        Map<String, EvaluationDiagnostic> byMetric = new HashMap<>();
        for (EvaluationDiagnostic d : result.diagnostics())
            byMetric.put(d.metric(), d);

        assertEquals(3, result.diagnostics().size());
        assertEquals(DiagnosticCode.DIVIDE_BY_ZERO, byMetric.get("DSCR").code());
        assertEquals("DEBT_SERVICE", byMetric.get("DSCR").operand());
        assertEquals(DiagnosticCode.DIVIDE_BY_ZERO, byMetric.get("DSCR_STRESSED").code());
        assertEquals(DiagnosticCode.MISSING_DEPENDENCY, byMetric.get("NET_MARGIN").code());
        assertEquals("REVENUE", byMetric.get("NET_MARGIN").operand());
        assertTrue(byMetric.get("NET_MARGIN").message().contains("NET_MARGIN"));
        assertTrue(byMetric.get("NET_MARGIN").message().contains("REVENUE"));
    }

    @Test
    public void testOverflowReportedAsInvalidOp() {
        List<MetricDefinition> metrics = List.of(
                MetricDefinition.of("HUGE", Formula.of("multiply", "X", "X"), "X"));
        MetricGraphEvaluator.DiagnosticResult result = evaluator.evaluateWithDiagnostics(metrics,
                base("X", Double.MAX_VALUE));
        assertNull(result.values().get("HUGE"));
        assertEquals(DiagnosticCode.INVALID_OP, result.diagnostics().get(0).code());
    }

    @Test
    public void testAuditValuesEqualPlainValues() {
        Map<String, Double> base = base("CFADS", 1000, "DEBT_SERVICE", 0, "NET_INCOME", 50, "REVENUE", 1000);
        Map<String, Double> plain = evaluator.evaluate(METRICS, base);
        MetricGraphEvaluator.AuditResult audit = evaluator.evaluateWithAudit(METRICS, base);

        assertEquals(plain, audit.values());
        assertEquals(List.of("CFADS"), audit.dependencyGraph().get("CFADS_STRESSED"));
        assertEquals(List.of("CFADS_STRESSED", "DEBT_SERVICE"), audit.dependencyGraph().get("DSCR_STRESSED"));
        assertEquals(METRICS.size(), audit.dependencyGraph().size());
    }

    @Test
    public void testCycleAbortsEveryVariant() {
        List<MetricDefinition> cyclic = List.of(
                MetricDefinition.of("A", Formula.of("add", "B", "1"), "B"),
                MetricDefinition.of("B", Formula.of("add", "A", "1"), "A"));
        int failures = 0;
        try {
            evaluator.evaluate(cyclic, Map.of());
        } catch (MetricCycleException e) {
            failures++;
        }
        try {
            evaluator.evaluateWithDiagnostics(cyclic, Map.of());
        } catch (MetricCycleException e) {
            failures++;
        }
        try {
            evaluator.evaluateWithAudit(cyclic, Map.of());
        } catch (MetricCycleException e) {
            failures++;
        }
        assertEquals(3, failures);
    }

    @Test
    public void testSortOrdersDependenciesFirst() {
        List<MetricDefinition> reversed = new ArrayList<>(METRICS);
        java.util.Collections.reverse(reversed);
        List<String> keys = MetricGraphEvaluator.sort(reversed).stream().map(MetricDefinition::key).toList();
        assertTrue(keys.indexOf("CFADS_STRESSED") < keys.indexOf("DSCR_STRESSED"));
    }

    @Test
    public void testLiteralOperands() {
        assertEquals(3.0, MetricGraphEvaluator.evaluateFormula(Formula.of("add", "1", "2"), Map.of()), 0.0);
        assertNull(MetricGraphEvaluator.evaluateFormula(Formula.of("divide", "1", "0"), Map.of()));
        assertNull(MetricGraphEvaluator.evaluateFormula(Formula.of("subtract", "A", "1"), Map.of()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOperatorRejectedAtConstruction() {
        Formula.of("power", "A", "2");
    }

    @Test
    public void testListenerReceivesFailures() {
        RecordingListener listener = new RecordingListener();
        evaluator.setListener(listener);
        evaluator.evaluate(METRICS, base("CFADS", 1000, "DEBT_SERVICE", 0));

        assertEquals(4, listener.started);
        assertEquals(1, listener.ended);
        assertEquals(4, listener.evaluated.size());
        assertEquals(List.of("DSCR", "DSCR_STRESSED", "NET_MARGIN"),
                listener.failed.stream().map(EvaluationDiagnostic::metric).sorted().toList());
    }

    private static final class RecordingListener implements EvaluationListener {
        int started;
        int ended;
        final List<String> evaluated = new ArrayList<>();
        final List<EvaluationDiagnostic> failed = new ArrayList<>();

        @Override
        public void onEvaluationStart(int metricCount) {
            started = metricCount;
        }

        @Override
        public void onMetricEvaluated(int topoIndex, String metricKey, Double value) {
            evaluated.add(metricKey);
        }

        @Override
        public void onMetricFailed(int topoIndex, EvaluationDiagnostic diagnostic) {
            failed.add(diagnostic);
        }

        @Override
        public void onEvaluationEnd(int evaluatedCount) {
            ended = evaluatedCount;
        }
    }
}

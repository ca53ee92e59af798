package com.credit.modelengine.util;

import com.credit.modelengine.engine.Formula;
import com.credit.modelengine.engine.MetricDefinition;
import com.credit.modelengine.engine.MetricGraphEvaluator;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class MetricGraphExplainTest {

    // declared out of order on purpose
    private static final List<MetricDefinition> METRICS = List.of(
            MetricDefinition.of("B", Formula.of("multiply", "A", "2"), "A"),
            MetricDefinition.of("A", Formula.of("divide", "X", "Y"), "X", "Y"));

    private static MetricGraphEvaluator.AuditResult audit() {
        return new MetricGraphEvaluator().evaluateWithAudit(METRICS, Map.of("X", 10.0, "Y", 4.0));
    }

    @Test
    public void testDumpTopology() {
        MetricGraphExplain explain = new MetricGraphExplain(METRICS, audit().values());
        assertEquals("""
                Metric graph (2 metrics):
                  [0] A = divide(X, Y) : 2.5000 -> B
                  [1] B = multiply(A, 2) : 5.0000
                """, explain.dumpTopology());
    }

    @Test
    public void testExplainMetric() {
        MetricGraphEvaluator.AuditResult result = audit();
        String text = new MetricGraphExplain(METRICS, result.values(), result.dependencyGraph()).explainMetric("A");

        assertTrue(text.startsWith("Metric: A\n"));
        assertTrue(text.contains("  Topo index: 0\n"));
        assertTrue(text.contains("  Formula: divide(X, Y)\n"));
        assertTrue(text.contains("  Value: 2.5000\n"));
        assertTrue(text.contains("  Reads: X=10.0000, Y=4.0000\n"));
        assertTrue(text.contains("  Metric inputs: 0\n"));
        assertTrue(text.contains("  Dependents (1): B\n"));

        String dependent = new MetricGraphExplain(METRICS, result.values(), result.dependencyGraph()).explainMetric("B");
        assertTrue(dependent.contains("  Metric inputs: 1\n"));
        assertTrue(dependent.contains("  Dependents (0): \n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownMetric() {
        new MetricGraphExplain(METRICS, Map.of()).explainMetric("NOPE");
    }

    @Test
    public void testMermaidWithInputs() {
        MetricGraphEvaluator.AuditResult result = audit();
        String mermaid = new MetricGraphExplain(METRICS, result.values(), result.dependencyGraph()).toMermaid();

        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("  X([\"X<br/>10.0000\"]);\n"));
        assertTrue(mermaid.contains("  A[\"A<br/>2.5000\"];\n"));
        assertTrue(mermaid.contains("  X --> A;\n"));
        assertTrue(mermaid.contains("  Y --> A;\n"));
        assertTrue(mermaid.contains("  A --> B;\n"));
    }

    @Test
    public void testMermaidWithoutInputs() {
        String mermaid = new MetricGraphExplain(METRICS, audit().values()).toMermaid();
        assertFalse(mermaid.contains("X"));
        assertTrue(mermaid.contains("  A --> B;\n"));
    }
}

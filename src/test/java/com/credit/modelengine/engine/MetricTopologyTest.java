package com.credit.modelengine.engine;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class MetricTopologyTest {

    private static MetricDefinition metric(String key) {
        return MetricDefinition.of(key, Formula.of("add", "BASE", "1"));
    }

    @Test
    public void testEmptyGraph() {
        MetricTopology order = MetricTopology.builder().build();
        assertEquals(0, order.metricCount());
    }

    @Test
    public void testLinearGraph() {
        // A -> B -> C
        MetricTopology order = MetricTopology.builder()
                .addMetric(metric("C")).addMetric(metric("B")).addMetric(metric("A"))
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(3, order.metricCount());
        assertEquals("A", order.metric(0).key());
        assertEquals("B", order.metric(1).key());
        assertEquals("C", order.metric(2).key());

        assertEquals(1, order.childCount(0));
        assertEquals(1, order.child(0, 0));
        assertEquals(0, order.childCount(2));

        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.parentCount(2));
    }

    @Test
    public void testDiamondGraph() {
        MetricTopology order = MetricTopology.builder()
                .addMetric(metric("D")).addMetric(metric("C")).addMetric(metric("B")).addMetric(metric("A"))
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        int idxA = order.topoIndex("A");
        int idxB = order.topoIndex("B");
        int idxC = order.topoIndex("C");
        int idxD = order.topoIndex("D");

        assertEquals(0, idxA);
        assertTrue(idxD > idxB);
        assertTrue(idxD > idxC);
        assertEquals(2, order.childCount(idxA));
        assertEquals(2, order.parentCount(idxD));
    }

    @Test
    public void testEdgesFromFormulaOperands() {
        // MARGIN reads PROFIT through its formula without declaring it
        MetricDefinition margin = MetricDefinition.of("MARGIN", Formula.of("divide", "PROFIT", "REVENUE"));
        MetricDefinition profit = MetricDefinition.of("PROFIT", Formula.of("subtract", "REVENUE", "COSTS"),
                "REVENUE", "COSTS");

        MetricTopology order = MetricTopology.of(List.of(margin, profit));
        assertEquals("PROFIT", order.metric(0).key());
        assertEquals("MARGIN", order.metric(1).key());
        assertTrue(order.contains("PROFIT"));
        assertFalse(order.contains("REVENUE"));
    }

    @Test
    public void testCycleDetection() {
        MetricDefinition a = MetricDefinition.of("A", Formula.of("add", "B", "1"), "B");
        MetricDefinition b = MetricDefinition.of("B", Formula.of("add", "A", "1"), "A");
        try {
            MetricTopology.of(List.of(a, b));
            fail("cycle not detected");
        } catch (MetricCycleException e) {
            assertEquals("A", e.metricKey());
            assertEquals(List.of("A", "B"), e.unresolved());
            assertTrue(e.getMessage().contains("'A'"));
        }
    }

    @Test
    public void testCycleNamedPastDownstreamMetric() {
        // X only reads the cycle, it is not part of it
        try {
            MetricTopology.of(List.of(
                    MetricDefinition.of("X", Formula.of("add", "A", "1")),
                    MetricDefinition.of("A", Formula.of("add", "B", "1")),
                    MetricDefinition.of("B", Formula.of("add", "A", "1"))));
            fail("cycle not detected");
        } catch (MetricCycleException e) {
            assertEquals("A", e.metricKey());
            assertEquals(List.of("X", "A", "B"), e.unresolved());
        }
    }

    @Test
    public void testLongCycleNamedByEarliestMember() {
        try {
            MetricTopology.of(List.of(
                    MetricDefinition.of("D", Formula.of("subtract", "C", "BASE")),
                    MetricDefinition.of("E", Formula.of("add", "D", "1")),
                    MetricDefinition.of("B", Formula.of("add", "A", "1")),
                    MetricDefinition.of("C", Formula.of("add", "B", "1")),
                    MetricDefinition.of("A", Formula.of("add", "C", "1"))));
            fail("cycle not detected");
        } catch (MetricCycleException e) {
            assertEquals("B", e.metricKey());
            assertEquals(List.of("D", "E", "B", "C", "A"), e.unresolved());
        }
    }

    @Test(expected = MetricCycleException.class)
    public void testLongCycleDetection() {
        MetricTopology.of(List.of(
                MetricDefinition.of("A", Formula.of("add", "C", "1")),
                MetricDefinition.of("B", Formula.of("add", "A", "1")),
                MetricDefinition.of("C", Formula.of("add", "B", "1")),
                MetricDefinition.of("D", Formula.of("add", "BASE", "1"))));
    }

    @Test(expected = MetricCycleException.class)
    public void testSelfLoopDetection() {
        MetricTopology.of(List.of(MetricDefinition.of("A", Formula.of("multiply", "A", "2"))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateKeyRejected() {
        MetricTopology.builder().addMetric(metric("A")).addMetric(metric("A"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownMetricLookup() {
        MetricTopology.builder().addMetric(metric("A")).build().topoIndex("B");
    }
}

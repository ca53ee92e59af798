package com.credit.modelengine.risk;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class RiskEvaluatorTest {

    private final RiskEvaluator evaluator = new RiskEvaluator();

    @Test
    public void testHealthyMetricsRaiseNothing() {
        assertTrue(evaluator.evaluate(Map.of("DSCR", 1.5, "LEVERAGE", 3.0, "CURRENT_RATIO", 1.2,
                "NET_MARGIN", 0.05)).isEmpty());
    }

    @Test
    public void testBoundariesAreInclusive() {
        assertTrue(evaluator.evaluate(Map.of("DSCR", 1.25, "LEVERAGE", 4.0, "CURRENT_RATIO", 1.0,
                "NET_MARGIN", 0.0)).isEmpty());
    }

    @Test
    public void testBreaches() {
        List<RiskFlag> flags = evaluator.evaluate(Map.of("DSCR", 1.1, "LEVERAGE", 5.5, "NET_MARGIN", -0.02));

        assertEquals(List.of("DSCR_BELOW_MIN", "LEVERAGE_ABOVE_MAX", "NEGATIVE_NET_MARGIN"),
                flags.stream().map(RiskFlag::code).toList());
        RiskFlag dscr = flags.get(0);
        assertEquals(RiskSeverity.HIGH, dscr.severity());
        assertEquals(1.1, dscr.value(), 0.0);
        assertEquals(1.25, dscr.threshold(), 0.0);
        assertEquals("DSCR 1.1000 < 1.2500", dscr.message());
        assertEquals(RiskSeverity.MEDIUM, flags.get(2).severity());
    }

    @Test
    public void testMissingMetricNeverFlags() {
        Map<String, Double> metrics = new HashMap<>();
        metrics.put("DSCR", null);
        assertTrue(evaluator.evaluate(metrics).isEmpty());
    }

    @Test
    public void testCustomRules() {
        RiskEvaluator custom = new RiskEvaluator(List.of(
                new RiskRule("THIN_CASH", "CASH", RiskRule.Comparison.BELOW, 100_000, RiskSeverity.LOW)));
        List<RiskFlag> flags = custom.evaluate(Map.of("CASH", 50_000.0, "DSCR", 0.5));
        assertEquals(1, flags.size());
        assertEquals("THIN_CASH", flags.get(0).code());
        assertEquals(1, custom.rules().size());
    }
}

package com.credit.modelengine.parity;

import org.junit.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ParityEngineTest {

    private final ParityEngine engine = new ParityEngine();

    private static PeriodMetrics period(String end, Object... kv) {
        Map<ParityMetric, Double> m = new EnumMap<>(ParityMetric.class);
        for (int i = 0; i < kv.length; i += 2)
            m.put((ParityMetric) kv[i], ((Number) kv[i + 1]).doubleValue());
        return new PeriodMetrics(end, end, m);
    }

    private ParityReport compareOne(ParityMetric metric, double left, double right) {
        return engine.compare("D1", List.of(period("2024-12-31", metric, left)),
                List.of(period("2024-12-31", metric, right)));
    }

    @Test
    public void testIdenticalSidesPass() {
        PeriodMetrics p = period("2024-12-31", ParityMetric.REVENUE, 1_000_000, ParityMetric.EBITDA, 450_000);
        ParityReport report = engine.compare("D1", List.of(p), List.of(p));

        assertEquals(GateVerdict.PASS, report.verdict());
        assertTrue(report.passed());
        assertEquals(0, report.summary().totalDifferences());
        assertFalse(report.summary().materiallyDifferent());
        assertNull(report.generatedAt());
        assertEquals("2025-03-01T00:00:00Z", report.withGeneratedAt("2025-03-01T00:00:00Z").generatedAt());
    }

    @Test
    public void testOneDollarIsNotMaterial() {
        ParityReport report = compareOne(ParityMetric.REVENUE, 1_000_000.00, 1_000_001.00);
        MetricDiff diff = report.diffs().get(0);

        assertEquals(1.0, diff.delta(), 1e-9);
        assertFalse(diff.material());
        assertEquals(1, report.summary().totalDifferences());
        assertEquals(GateVerdict.PASS, report.verdict());
    }

    @Test
    public void testOneDollarAndOneCentIsMaterial() {
        ParityReport report = compareOne(ParityMetric.REVENUE, 1_000_000.00, 1_000_001.01);
        MetricDiff diff = report.diffs().get(0);

        assertTrue(diff.material());
        assertEquals(DiffLevel.WARN, diff.level());
        assertEquals(GateVerdict.WARN, report.verdict());
        assertTrue(report.summary().materiallyDifferent());
    }

    @Test
    public void testMaterialityBoundaries() {
        assertFalse(ParityEngine.isMaterial(1_000_000, 1.0));
        assertTrue(ParityEngine.isMaterial(1_000_000, 1.01));
        // relative leg dominates for small values
        assertTrue(ParityEngine.isMaterial(10, 0.01));
        assertFalse(ParityEngine.isMaterial(0.5, 0.0001));
    }

    @Test
    public void testScalingErrorDetected() {
        ParityReport report = compareOne(ParityMetric.REVENUE, 2_571, 2_571_777);

        assertEquals(1, report.flagsOf(FlagType.SCALING_ERROR).size());
        assertEquals(Severity.ERROR, report.flagsOf(FlagType.SCALING_ERROR).get(0).severity());
        assertEquals(GateVerdict.BLOCK, report.verdict());
        assertFalse(report.passed());
    }

    @Test
    public void testNearEqualValuesNotScalingError() {
        ParityReport report = compareOne(ParityMetric.REVENUE, 2_571_777, 2_571_778);
        assertTrue(report.flagsOf(FlagType.SCALING_ERROR).isEmpty());
        assertTrue(report.passed());
    }

    @Test
    public void testSignFlipIsError() {
        ParityReport report = compareOne(ParityMetric.NET_INCOME, 50_000, -50_000);
        assertEquals(1, report.flagsOf(FlagType.SIGN_FLIP).size());
        assertTrue(report.hasErrors());
        assertFalse(report.passed());
    }

    @Test
    public void testZeroFillIsWarning() {
        ParityReport report = compareOne(ParityMetric.CASH, 0, 25_000);
        List<ParityFlag> zero = report.flagsOf(FlagType.ZERO_FILL);
        assertEquals(1, zero.size());
        assertEquals(Severity.WARNING, zero.get(0).severity());
        assertEquals(Double.POSITIVE_INFINITY, report.diffs().get(0).pctDelta(), 0.0);
    }

    @Test
    public void testPeriodAlignment() {
        List<PeriodMetrics> legacy = List.of(
                period("2023-12-31", ParityMetric.REVENUE, 900),
                period("2024-12-31", ParityMetric.REVENUE, 1000));
        List<PeriodMetrics> model = List.of(
                period("2024-12-31", ParityMetric.REVENUE, 1000),
                period("2025-06-30", ParityMetric.REVENUE, 600));

        ParityReport report = engine.compare("D1", legacy, model);

        assertEquals(3, report.periods().size());
        assertEquals(PeriodAlignment.Source.LEFT_ONLY, report.periods().get(0).source());
        assertTrue(report.periods().get(1).aligned());
        assertEquals(PeriodAlignment.Source.RIGHT_ONLY, report.periods().get(2).source());

        List<ParityFlag> missing = report.flagsOf(FlagType.MISSING_PERIOD);
        assertEquals(2, missing.size());
        assertEquals(Severity.ERROR, missing.get(0).severity());
        assertEquals("2023-12-31", missing.get(0).periodEnd());
        assertEquals(Severity.WARNING, missing.get(1).severity());

        // legacy coverage regressed: not a pass, but no cell crossed BLOCK
        assertEquals(GateVerdict.WARN, report.verdict());
        assertFalse(report.passed());
    }

    @Test
    public void testMissingPeriodToleratedWhenConfigured() {
        ParityThresholds lenient = new ParityThresholds(
                ParityThresholds.DEFAULT.incomeStatement(), ParityThresholds.DEFAULT.balanceSheet(),
                ParityThresholds.DEFAULT.derived(), 1.0, 0.0001, false);
        ParityReport report = engine.compare("D1",
                List.of(period("2023-12-31", ParityMetric.REVENUE, 900), period("2024-12-31", ParityMetric.REVENUE, 1)),
                List.of(period("2024-12-31", ParityMetric.REVENUE, 1)), lenient);
        assertTrue(report.passed());
    }

    @Test
    public void testOneSidedMetricNotedNotDiffed() {
        ParityReport report = engine.compare("D1",
                List.of(period("2024-12-31", ParityMetric.REVENUE, 1000, ParityMetric.CASH, 50)),
                List.of(period("2024-12-31", ParityMetric.REVENUE, 1000)));

        assertEquals(1, report.diffs().size());
        assertEquals(ParityMetric.REVENUE, report.diffs().get(0).metric());
        assertEquals(1, report.flagsOf(FlagType.MISSING_ROW).size());
        assertEquals("cash", report.flagsOf(FlagType.MISSING_ROW).get(0).metric());
        assertEquals(1, report.notes().size());
        assertTrue(report.notes().get(0).contains("Cash"));
        assertTrue(report.passed());
    }

    @Test
    public void testBlockThresholdByCategory() {
        // $2,000 off on a balance sheet line crosses BLOCK
        ParityReport report = compareOne(ParityMetric.TOTAL_ASSETS, 1_000_000, 1_002_000);
        assertEquals(DiffLevel.BLOCK, report.diffs().get(0).level());
        assertEquals(GateVerdict.BLOCK, report.verdict());

        // same gap under relaxed thresholds only warns
        ParityReport relaxed = engine.compare("D1",
                List.of(period("2024-12-31", ParityMetric.TOTAL_ASSETS, 1_000_000)),
                List.of(period("2024-12-31", ParityMetric.TOTAL_ASSETS, 1_002_000)), ParityThresholds.RELAXED);
        assertEquals(GateVerdict.WARN, relaxed.verdict());
    }

    @Test
    public void testHeadlineOutsideToleranceFails() {
        // material but below BLOCK: gate warns, headline check fails the report
        ParityReport report = compareOne(ParityMetric.EBITDA, 1_000_000, 1_000_500);
        assertEquals(GateVerdict.WARN, report.verdict());
        HeadlineCheck check = report.headline().stream()
                .filter(h -> h.metric() == ParityMetric.EBITDA).findFirst().orElseThrow();
        assertFalse(check.withinTolerance());
        assertFalse(report.passed());
    }

    @Test
    public void testNonHeadlineDriftStillPasses() {
        ParityReport report = compareOne(ParityMetric.COGS, 1_000_000, 1_000_500);
        assertEquals(GateVerdict.WARN, report.verdict());
        assertTrue(report.passed());
    }

    @Test
    public void testSummaryTracksLargestDelta() {
        ParityReport report = engine.compare("D1",
                List.of(period("2024-12-31", ParityMetric.REVENUE, 1000, ParityMetric.COGS, 500)),
                List.of(period("2024-12-31", ParityMetric.REVENUE, 1003, ParityMetric.COGS, 490)));
        assertEquals(10.0, report.summary().maxAbsDelta(), 1e-9);
        assertEquals(2, report.summary().totalDifferences());
        assertEquals(2, report.summary().materialCount());
    }
}

package com.credit.modelengine.parity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.Assert.*;

public class LegacySpreadAdapterTest {

    static List<LegacySpread> fixture() throws IOException {
        try (InputStream in = LegacySpreadAdapterTest.class.getResourceAsStream("/parity/legacy-spreads.json")) {
            return new ObjectMapper().readValue(in, new TypeReference<List<LegacySpread>>() {
            });
        }
    }

    @Test
    public void testFixtureAdapts() throws IOException {
        List<PeriodMetrics> periods = LegacySpreadAdapter.adapt(fixture());

        // TTM and YTD columns never become periods
        assertEquals(2, periods.size());
        assertEquals("2023-12-31", periods.get(0).periodEnd());
        assertEquals("2024-12-31", periods.get(1).periodEnd());

        PeriodMetrics p2024 = periods.get(1);
        assertEquals("Dec 2024", p2024.label());
        assertEquals(1_000_000.0, p2024.get(ParityMetric.REVENUE), 0.0);
        assertEquals(400_000.0, p2024.get(ParityMetric.COGS), 0.0);
        assertEquals(200_000.0, p2024.get(ParityMetric.OPERATING_EXPENSES), 0.0);
        assertEquals(210_000.0, p2024.get(ParityMetric.NET_INCOME), 0.0);
        assertEquals(250_000.0, p2024.get(ParityMetric.CASH), 0.0);
        assertEquals(2_000_000.0, p2024.get(ParityMetric.EQUITY), 0.0);
        assertEquals(2.0, p2024.get(ParityMetric.LEVERAGE_DEBT_TO_EBITDA), 1e-12);
        assertEquals(10, p2024.metrics().size());
    }

    @Test
    public void testPeriodWithoutDebtHasNoLeverage() throws IOException {
        PeriodMetrics p2023 = LegacySpreadAdapter.adapt(fixture()).get(0);
        assertEquals(900_000.0, p2023.get(ParityMetric.REVENUE), 0.0);
        assertFalse(p2023.has(ParityMetric.LEVERAGE_DEBT_TO_EBITDA));
        assertFalse(p2023.has(ParityMetric.NET_INCOME));
        assertFalse(p2023.has(ParityMetric.TOTAL_ASSETS));
    }

    @Test
    public void testAggregateColumns() {
        LegacySpread spread = new LegacySpread("T12")
                .column("a", "TTM", null, null)
                .column("b", "PY YTD", null, null)
                .column("c", "Jun 2025", "ytd", null)
                .column("d", "Jun 2025", null, null);
        List<LegacySpread.Column> cols = spread.getColumns();

        assertTrue(LegacySpreadAdapter.isAggregate(cols.get(0)));
        assertTrue(LegacySpreadAdapter.isAggregate(cols.get(1)));
        assertTrue(LegacySpreadAdapter.isAggregate(cols.get(2)));
        assertFalse(LegacySpreadAdapter.isAggregate(cols.get(3)));
        assertEquals(1, LegacySpreadAdapter.discreteColumns(spread).size());
    }

    @Test
    public void testEndDateInference() {
        assertEquals("2024-12-31", LegacySpreadAdapter.inferEndDate("Dec 2024"));
        assertEquals("2024-02-29", LegacySpreadAdapter.inferEndDate("Feb 2024"));
        assertNull(LegacySpreadAdapter.inferEndDate("FY2024"));
        assertNull(LegacySpreadAdapter.inferEndDate("December 2024"));

        LegacySpread spread = new LegacySpread("T12").column("x", "Mar 2025", null, "2024-12-31T00:00:00Z");
        assertEquals("2024-12-31", LegacySpreadAdapter.endDate(spread.getColumns().get(0)));
    }

    @Test
    public void testScalarRowIgnoredWithSeveralColumns() {
        LegacySpread spread = new LegacySpread("BALANCE_SHEET")
                .column("a", "Dec 2023", null, null)
                .column("b", "Dec 2024", null, null)
                .scalarRow("TOTAL_ASSETS", 5_000_000.0)
                .row("CASH_AND_EQUIVALENTS", Map.of("b", 10.0));

        List<PeriodMetrics> periods = LegacySpreadAdapter.adapt(List.of(spread));
        assertEquals(2, periods.size());
        assertFalse(periods.get(0).has(ParityMetric.TOTAL_ASSETS));
        assertFalse(periods.get(1).has(ParityMetric.TOTAL_ASSETS));
        assertFalse(periods.get(0).has(ParityMetric.CASH));
        assertEquals(10.0, periods.get(1).get(ParityMetric.CASH), 0.0);
    }

    @Test
    public void testUndatedColumnSkipped() {
        LegacySpread spread = new LegacySpread("T12")
                .column("a", "Current", null, null)
                .scalarRow("TOTAL_REVENUE", 1.0);
        assertTrue(LegacySpreadAdapter.adapt(List.of(spread)).isEmpty());
    }

    @Test
    public void testZeroEbitdaYieldsNoLeverage() {
        LegacySpread spread = new LegacySpread("BALANCE_SHEET")
                .column("a", "Dec 2024", null, null)
                .scalarRow("EBITDA", 0.0)
                .scalarRow("LONG_TERM_DEBT", 100.0);
        PeriodMetrics p = LegacySpreadAdapter.adapt(List.of(spread)).get(0);
        assertEquals(0.0, p.get(ParityMetric.EBITDA), 0.0);
        assertFalse(p.has(ParityMetric.LEVERAGE_DEBT_TO_EBITDA));
    }

    @Test
    public void testMissingRowsOrColumnsSkipped() {
        LegacySpread rowless = new LegacySpread("T12").column("a", "Dec 2024", null, null);
        rowless.setRows(null);
        LegacySpread columnless = new LegacySpread("BALANCE_SHEET").scalarRow("TOTAL_ASSETS", 1.0);
        columnless.setColumns(null);
        LegacySpread good = new LegacySpread("T12")
                .column("a", "Dec 2024", null, null)
                .scalarRow("TOTAL_REVENUE", 10.0);

        List<PeriodMetrics> periods = LegacySpreadAdapter.adapt(Arrays.asList(rowless, null, columnless, good));
        assertEquals(1, periods.size());
        assertEquals(10.0, periods.get(0).get(ParityMetric.REVENUE), 0.0);
    }

    @Test
    public void testAggregateKindIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            LegacySpread.Column column = new LegacySpread("T12").column("a", "Dec 2024", "PRIOR_YTD", null)
                    .getColumns().get(0);
            assertTrue(LegacySpreadAdapter.isAggregate(column));
        } finally {
            Locale.setDefault(previous);
        }
    }
}

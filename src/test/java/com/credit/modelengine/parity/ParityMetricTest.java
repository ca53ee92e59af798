package com.credit.modelengine.parity;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ParityMetricTest {

    @Test
    public void testDictionaryIsFrozen() {
        assertEquals(ParityMetric.EXPECTED_COUNT, ParityMetric.values().length);
        assertEquals(10, ParityMetric.values().length);
    }

    @Test
    public void testCategorySplit() {
        int income = 0, balance = 0, derived = 0;
        for (ParityMetric m : ParityMetric.values()) {
            switch (m.category()) {
                case INCOME_STATEMENT -> income++;
                case BALANCE_SHEET -> balance++;
                case DERIVED -> derived++;
            }
        }
        assertEquals(5, income);
        assertEquals(4, balance);
        assertEquals(1, derived);
    }

    @Test
    public void testHeadlineMetrics() {
        assertEquals(List.of(ParityMetric.REVENUE, ParityMetric.EBITDA, ParityMetric.TOTAL_LIABILITIES,
                ParityMetric.EQUITY, ParityMetric.LEVERAGE_DEBT_TO_EBITDA), ParityMetric.headlineMetrics());
    }

    @Test
    public void testKeyLookup() {
        assertEquals(ParityMetric.LEVERAGE_DEBT_TO_EBITDA, ParityMetric.fromKey("leverageDebtToEbitda"));
        assertEquals(ParityMetric.OPERATING_EXPENSES, ParityMetric.fromKey("operatingExpenses"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownKeyRejected() {
        ParityMetric.fromKey("grossMargin");
    }
}

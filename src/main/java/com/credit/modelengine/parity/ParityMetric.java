package com.credit.modelengine.parity;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Frozen dictionary of the metrics compared between the legacy rendering and
 * the model. Adapters, thresholds, headline checks and the report formatter all
 * consume this enum; adding a constant changes every one of them.
 */
public enum ParityMetric {
    // Income statement
    REVENUE("revenue", MetricCategory.INCOME_STATEMENT, "Revenue", true),
    COGS("cogs", MetricCategory.INCOME_STATEMENT, "Cost of Goods Sold", false),
    OPERATING_EXPENSES("operatingExpenses", MetricCategory.INCOME_STATEMENT, "Operating Expenses", false),
    EBITDA("ebitda", MetricCategory.INCOME_STATEMENT, "EBITDA", true),
    NET_INCOME("netIncome", MetricCategory.INCOME_STATEMENT, "Net Income", false),
    // Balance sheet
    CASH("cash", MetricCategory.BALANCE_SHEET, "Cash & Equivalents", false),
    TOTAL_ASSETS("totalAssets", MetricCategory.BALANCE_SHEET, "Total Assets", false),
    TOTAL_LIABILITIES("totalLiabilities", MetricCategory.BALANCE_SHEET, "Total Liabilities", true),
    EQUITY("equity", MetricCategory.BALANCE_SHEET, "Total Equity", true),
    // Derived
    LEVERAGE_DEBT_TO_EBITDA("leverageDebtToEbitda", MetricCategory.DERIVED, "Leverage (Debt/EBITDA)", true);

    /** Size of the dictionary. Guarded by a test. */
    public static final int EXPECTED_COUNT = 10;

    private static final Map<String, ParityMetric> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ParityMetric::key, Function.identity()));

    private final String key;
    private final MetricCategory category;
    private final String label;
    private final boolean headline;

    ParityMetric(String key, MetricCategory category, String label, boolean headline) {
        this.key = key;
        this.category = category;
        this.label = label;
        this.headline = headline;
    }

    public String key() {
        return key;
    }

    public MetricCategory category() {
        return category;
    }

    public String label() {
        return label;
    }

    public boolean headline() {
        return headline;
    }

    public static ParityMetric fromKey(String key) {
        ParityMetric metric = BY_KEY.get(key);
        if (metric == null)
            throw new IllegalArgumentException("Unknown parity metric: " + key);
        return metric;
    }

    public static List<ParityMetric> headlineMetrics() {
        return Arrays.stream(values()).filter(ParityMetric::headline).toList();
    }
}

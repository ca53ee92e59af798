package com.credit.modelengine.parity;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.credit.modelengine.model.BalanceSheet;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.model.FinancialPeriod;

/** Normalizes model periods into {@link PeriodMetrics}. */
public final class ModelParityAdapter {

    static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.US);

    private ModelParityAdapter() {
    }

    public static List<PeriodMetrics> adapt(FinancialModel model) {
        List<PeriodMetrics> out = new ArrayList<>(model.periods().size());
        for (FinancialPeriod period : model.periods())
            out.add(adapt(period));
        return out;
    }

    public static PeriodMetrics adapt(FinancialPeriod period) {
        Map<ParityMetric, Double> m = new EnumMap<>(ParityMetric.class);
        BalanceSheet balance = period.getBalance();

        putIfPresent(m, ParityMetric.REVENUE, period.getIncome().getRevenue());
        putIfPresent(m, ParityMetric.COGS, period.getIncome().getCogs());
        putIfPresent(m, ParityMetric.OPERATING_EXPENSES, period.getIncome().getOperatingExpenses());
        putIfPresent(m, ParityMetric.EBITDA, period.getCashflow().getEbitda());
        putIfPresent(m, ParityMetric.NET_INCOME, period.getIncome().getNetIncome());
        putIfPresent(m, ParityMetric.CASH, balance.getCash());
        putIfPresent(m, ParityMetric.TOTAL_ASSETS, balance.getTotalAssets());
        putIfPresent(m, ParityMetric.TOTAL_LIABILITIES, balance.getTotalLiabilities());
        putIfPresent(m, ParityMetric.EQUITY, balance.getEquity());

        Double debt = balance.totalDebt();
        Double ebitda = period.getCashflow().getEbitda();
        if (debt != null && ebitda != null && ebitda != 0.0)
            m.put(ParityMetric.LEVERAGE_DEBT_TO_EBITDA, debt / ebitda);

        return new PeriodMetrics(period.getPeriodEnd(), label(period.getPeriodEnd()), m);
    }

    /** {@code 2024-12-31} to {@code Dec 2024}. */
    public static String label(String periodEnd) {
        return LocalDate.parse(periodEnd).format(LABEL);
    }

    private static void putIfPresent(Map<ParityMetric, Double> m, ParityMetric metric, Double value) {
        if (value != null)
            m.put(metric, value);
    }
}

package com.credit.modelengine.builder;

import java.util.LinkedHashMap;
import java.util.Map;

import com.credit.modelengine.model.BalanceSheet;
import com.credit.modelengine.model.CashFlow;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.model.FinancialPeriod;
import com.credit.modelengine.model.IncomeStatement;

/**
 * Flattens a period into the base value map consumed by the metric graph.
 * Absent fields stay absent so that dependent metrics resolve to null.
 */
public final class BaseValueExtractor {

    private BaseValueExtractor() {
    }

    /** Base values of the latest period, or an empty map for an empty model. */
    public static Map<String, Double> extract(FinancialModel model) {
        return model.latestPeriod().map(BaseValueExtractor::extract).orElseGet(LinkedHashMap::new);
    }

    public static Map<String, Double> extract(FinancialPeriod period) {
        Map<String, Double> values = new LinkedHashMap<>();
        IncomeStatement in = period.getIncome();
        BalanceSheet bs = period.getBalance();
        CashFlow cf = period.getCashflow();

        put(values, "REVENUE", in.getRevenue());
        put(values, "COGS", in.getCogs());
        if (in.getRevenue() != null && in.getCogs() != null)
            values.put("GROSS_PROFIT", in.getRevenue() - in.getCogs());
        put(values, "OPERATING_EXPENSES", in.getOperatingExpenses());
        put(values, "DEPRECIATION", in.getDepreciation());
        put(values, "DEBT_SERVICE", in.getInterest());
        put(values, "NET_INCOME", in.getNetIncome());

        put(values, "EBITDA", cf.getEbitda());
        put(values, "CAPEX", cf.getCapex());
        put(values, "CFADS", cf.getCfads());

        put(values, "CASH", bs.getCash());
        put(values, "CURRENT_ASSETS", bs.getCurrentAssets());
        put(values, "TOTAL_ASSETS", bs.getTotalAssets());
        put(values, "CURRENT_LIABILITIES", bs.getCurrentLiabilities());
        put(values, "TOTAL_LIABILITIES", bs.getTotalLiabilities());
        put(values, "EQUITY", bs.getEquity());
        put(values, "TOTAL_DEBT", bs.totalDebt());
        return values;
    }

    private static void put(Map<String, Double> values, String key, Double value) {
        if (value != null)
            values.put(key, value);
    }
}

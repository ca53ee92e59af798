package com.credit.modelengine.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One fiscal snapshot of a deal, identified by {@code (dealId, periodEnd)}.
 *
 * <p>
 * Periods are always produced fresh by folding facts; they are never cloned
 * from another period or patched in place after a build.
 */
@Data
@NoArgsConstructor
public final class FinancialPeriod {
    private String periodId;
    private String periodEnd;
    private PeriodType type;
    private IncomeStatement income = new IncomeStatement();
    private BalanceSheet balance = new BalanceSheet();
    private CashFlow cashflow = new CashFlow();
    private List<QualityFlag> qualityFlags = new ArrayList<>();

    public FinancialPeriod(String dealId, String periodEnd, PeriodType type) {
        this.periodId = periodId(dealId, periodEnd);
        this.periodEnd = periodEnd;
        this.type = type;
    }

    public static String periodId(String dealId, String periodEnd) {
        return dealId + ":" + periodEnd;
    }

    public void addFlag(QualityFlag flag) {
        if (!qualityFlags.contains(flag))
            qualityFlags.add(flag);
    }

    public boolean hasFlag(QualityFlag flag) {
        return qualityFlags.contains(flag);
    }
}

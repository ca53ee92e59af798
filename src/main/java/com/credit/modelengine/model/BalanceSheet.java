package com.credit.modelengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** Sparse balance sheet. A {@code null} field means "not reported", never zero. */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BalanceSheet {
    private Double cash;
    private Double accountsReceivable;
    private Double inventory;
    private Double currentAssets;
    private Double totalAssets;
    private Double shortTermDebt;
    private Double longTermDebt;
    private Double currentLiabilities;
    private Double totalLiabilities;
    private Double equity;

    /**
     * Short plus long-term debt, or {@code null} when neither side is reported.
     * A single reported side counts the other as zero.
     */
    public Double totalDebt() {
        if (shortTermDebt == null && longTermDebt == null)
            return null;
        return (shortTermDebt == null ? 0.0 : shortTermDebt) + (longTermDebt == null ? 0.0 : longTermDebt);
    }
}

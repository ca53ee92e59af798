package com.credit.modelengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** Sparse income statement. A {@code null} field means "not reported", never zero. */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IncomeStatement {
    private Double revenue;
    private Double cogs;
    private Double operatingExpenses;
    private Double depreciation;
    private Double interest;
    private Double netIncome;
}

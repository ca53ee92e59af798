package com.credit.modelengine.render;

/** Statement groupings of the view model, in display order. */
public enum ViewSectionKind {
    BALANCE_SHEET("Balance Sheet"),
    INCOME_STATEMENT("Income Statement"),
    CASH_FLOW("Cash Flow"),
    RATIOS("Ratios");

    private final String title;

    ViewSectionKind(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}

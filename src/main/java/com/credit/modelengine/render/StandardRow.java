package com.credit.modelengine.render;

/**
 * Row layout of the standard spread. Statement rows read base values; ratio
 * rows read metrics computed through the registry.
 */
public enum StandardRow {
    CASH("CASH", "Cash & Equivalents", ViewSectionKind.BALANCE_SHEET, RowFormat.CURRENCY),
    CURRENT_ASSETS("CURRENT_ASSETS", "Total Current Assets", ViewSectionKind.BALANCE_SHEET, RowFormat.CURRENCY),
    TOTAL_ASSETS("TOTAL_ASSETS", "Total Assets", ViewSectionKind.BALANCE_SHEET, RowFormat.CURRENCY),
    CURRENT_LIABILITIES("CURRENT_LIABILITIES", "Total Current Liabilities", ViewSectionKind.BALANCE_SHEET, RowFormat.CURRENCY),
    TOTAL_DEBT("TOTAL_DEBT", "Total Debt", ViewSectionKind.BALANCE_SHEET, RowFormat.CURRENCY),
    TOTAL_LIABILITIES("TOTAL_LIABILITIES", "Total Liabilities", ViewSectionKind.BALANCE_SHEET, RowFormat.CURRENCY),
    EQUITY("EQUITY", "Total Equity", ViewSectionKind.BALANCE_SHEET, RowFormat.CURRENCY),

    REVENUE("REVENUE", "Revenue", ViewSectionKind.INCOME_STATEMENT, RowFormat.CURRENCY),
    COGS("COGS", "Cost of Goods Sold", ViewSectionKind.INCOME_STATEMENT, RowFormat.CURRENCY),
    GROSS_PROFIT("GROSS_PROFIT", "Gross Profit", ViewSectionKind.INCOME_STATEMENT, RowFormat.CURRENCY),
    OPERATING_EXPENSES("OPERATING_EXPENSES", "Operating Expenses", ViewSectionKind.INCOME_STATEMENT, RowFormat.CURRENCY),
    DEPRECIATION("DEPRECIATION", "Depreciation", ViewSectionKind.INCOME_STATEMENT, RowFormat.CURRENCY),
    NET_INCOME("NET_INCOME", "Net Income", ViewSectionKind.INCOME_STATEMENT, RowFormat.CURRENCY),

    EBITDA("EBITDA", "EBITDA", ViewSectionKind.CASH_FLOW, RowFormat.CURRENCY),
    CAPEX("CAPEX", "Capital Expenditures", ViewSectionKind.CASH_FLOW, RowFormat.CURRENCY),
    CFADS("CFADS", "Cash Flow Available for Debt Service", ViewSectionKind.CASH_FLOW, RowFormat.CURRENCY),
    DEBT_SERVICE("DEBT_SERVICE", "Debt Service", ViewSectionKind.CASH_FLOW, RowFormat.CURRENCY),
    EXCESS_CASH_FLOW("EXCESS_CASH_FLOW", "Excess Cash Flow", ViewSectionKind.CASH_FLOW, RowFormat.CURRENCY),

    GROSS_MARGIN("GROSS_MARGIN", "Gross Margin", ViewSectionKind.RATIOS, RowFormat.PERCENT),
    EBITDA_MARGIN("EBITDA_MARGIN", "EBITDA Margin", ViewSectionKind.RATIOS, RowFormat.PERCENT),
    NET_MARGIN("NET_MARGIN", "Net Margin", ViewSectionKind.RATIOS, RowFormat.PERCENT),
    ROA("ROA", "Return on Assets", ViewSectionKind.RATIOS, RowFormat.PERCENT),
    CURRENT_RATIO("CURRENT_RATIO", "Current Ratio", ViewSectionKind.RATIOS, RowFormat.RATIO),
    DEBT_TO_EQUITY("DEBT_TO_EQUITY", "Debt to Equity", ViewSectionKind.RATIOS, RowFormat.RATIO),
    LEVERAGE("LEVERAGE", "Leverage (Debt/EBITDA)", ViewSectionKind.RATIOS, RowFormat.RATIO),
    DSCR("DSCR", "DSCR", ViewSectionKind.RATIOS, RowFormat.RATIO),
    DSCR_STRESSED("DSCR_STRESSED", "DSCR (Stressed)", ViewSectionKind.RATIOS, RowFormat.RATIO);

    private final String key;
    private final String label;
    private final ViewSectionKind section;
    private final RowFormat format;

    StandardRow(String key, String label, ViewSectionKind section, RowFormat format) {
        this.key = key;
        this.label = label;
        this.section = section;
        this.format = format;
    }

    /** Base value or metric key the row reads. */
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public ViewSectionKind section() {
        return section;
    }

    public RowFormat format() {
        return format;
    }
}

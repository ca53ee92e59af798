package com.credit.modelengine.model;

/** Classification of a period by its end date month. */
public enum PeriodType {
    /** Fiscal-year-end: the period closes in December. */
    FYE,
    /** Trailing or year-to-date: any other month end. */
    TTM;

    public static PeriodType fromMonth(int month) {
        return month == 12 ? FYE : TTM;
    }
}

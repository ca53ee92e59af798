package com.credit.modelengine.model;

/** Data-quality findings attached to a period by the model builder. */
public enum QualityFlag {
    BALANCE_SHEET_IMBALANCE,
    NEGATIVE_REVENUE,
    MISSING_REVENUE,
    MISSING_TOTAL_ASSETS
}

package com.credit.modelengine.parity;

/** Threshold category of a parity metric. */
public enum MetricCategory {
    INCOME_STATEMENT,
    BALANCE_SHEET,
    DERIVED
}

package com.credit.modelengine.parity;

/** Threshold level crossed by a single metric difference. */
public enum DiffLevel {
    NONE,
    WARN,
    BLOCK
}

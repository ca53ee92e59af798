package com.credit.modelengine.engine;

/** Reasons a single metric resolved to null. */
public enum DiagnosticCode {
    MISSING_DEPENDENCY,
    DIVIDE_BY_ZERO,
    /** The operation produced a non-finite result. */
    INVALID_OP
}

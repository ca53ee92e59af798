package com.credit.modelengine.parity;

/** Classified parity anomalies. */
public enum FlagType {
    MISSING_PERIOD,
    MISSING_ROW,
    SIGN_FLIP,
    /** Values differ by a factor of about 1000, typically thousands against units. */
    SCALING_ERROR,
    /** One side exactly zero, the other not. */
    ZERO_FILL
}

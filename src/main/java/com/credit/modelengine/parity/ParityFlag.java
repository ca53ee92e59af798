package com.credit.modelengine.parity;

/**
 * A classified parity anomaly.
 *
 * @param metric parity metric key, null for period-level flags.
 */
public record ParityFlag(FlagType type, Severity severity, String metric, String periodEnd, String detail) {
}

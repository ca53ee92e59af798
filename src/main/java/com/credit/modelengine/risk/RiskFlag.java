package com.credit.modelengine.risk;

/**
 * A metric breaching a risk rule.
 *
 * @param code      stable rule code, e.g. {@code DSCR_BELOW_MIN}.
 * @param value     the offending metric value.
 * @param threshold the rule threshold.
 */
public record RiskFlag(String code, String metric, double value, double threshold, RiskSeverity severity,
        String message) {
}

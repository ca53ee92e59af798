package com.credit.modelengine.risk;

import java.util.Locale;

/**
 * Threshold rule over a single computed metric.
 */
public record RiskRule(String code, String metric, Comparison comparison, double threshold, RiskSeverity severity) {

    public enum Comparison {
        BELOW("<") {
            @Override
            boolean breached(double value, double threshold) {
                return value < threshold;
            }
        },
        ABOVE(">") {
            @Override
            boolean breached(double value, double threshold) {
                return value > threshold;
            }
        };

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        abstract boolean breached(double value, double threshold);
    }

    /** @return the flag, or {@code null} if the value is absent or within the rule. */
    public RiskFlag apply(Double value) {
        if (value == null || !comparison.breached(value, threshold))
            return null;
        String message = String.format(Locale.US, "%s %.4f %s %.4f", metric, value, comparison.symbol(), threshold);
        return new RiskFlag(code, metric, value, threshold, severity, message);
    }
}

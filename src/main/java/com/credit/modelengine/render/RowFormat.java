package com.credit.modelengine.render;

import java.util.Locale;

/** Display formatting of a view row. */
public enum RowFormat {
    /** Whole currency units, negatives in parentheses. */
    CURRENCY {
        @Override
        String formatValue(double v) {
            String s = String.format(Locale.US, "$%,.0f", Math.abs(v));
            return v < 0 ? "(" + s + ")" : s;
        }
    },
    /** Multiple, e.g. {@code 1.25x}. */
    RATIO {
        @Override
        String formatValue(double v) {
            return String.format(Locale.US, "%.2fx", v);
        }
    },
    /** Fraction shown as a percentage, e.g. {@code 0.125} as {@code 12.5%}. */
    PERCENT {
        @Override
        String formatValue(double v) {
            return String.format(Locale.US, "%.1f%%", v * 100);
        }
    };

    public static final String EMPTY = "—";

    public String format(Double value) {
        return value == null ? EMPTY : formatValue(value);
    }

    abstract String formatValue(double v);
}

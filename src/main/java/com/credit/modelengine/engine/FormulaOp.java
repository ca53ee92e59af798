package com.credit.modelengine.engine;

import java.util.Locale;

/** The closed set of binary operators a metric formula may use. */
public enum FormulaOp {
    ADD, SUBTRACT, MULTIPLY, DIVIDE;

    /**
     * Parses an operator tag such as {@code "divide"}.
     *
     * @throws IllegalArgumentException for any tag outside the four operators.
     */
    public static FormulaOp fromString(String tag) {
        if (tag == null)
            throw new IllegalArgumentException("Formula operator is required");
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported formula operator: " + tag, e);
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

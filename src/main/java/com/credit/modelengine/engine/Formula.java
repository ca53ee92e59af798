package com.credit.modelengine.engine;

import java.util.Objects;

/**
 * Two-operand formula node. Each operand is either a numeric literal
 * ({@code "0.9"}) or the key of a base value or another metric.
 */
public record Formula(FormulaOp op, String left, String right) {

    public Formula {
        Objects.requireNonNull(op, "op");
        if (left == null || left.isBlank() || right == null || right.isBlank())
            throw new IllegalArgumentException("Formula operands must be non-blank: " + left + ", " + right);
    }

    public static Formula of(String op, String left, String right) {
        return new Formula(FormulaOp.fromString(op), left, right);
    }

    /** Returns the operand as a literal, or {@code null} when it is a reference. */
    public static Double literal(String operand) {
        try {
            double v = Double.parseDouble(operand.trim());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return op.tag() + "(" + left + ", " + right + ")";
    }
}

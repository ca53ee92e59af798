package com.credit.modelengine.engine;

/**
 * Structured explanation of a metric that evaluated to null.
 *
 * @param metric  the failing metric key.
 * @param code    typed reason.
 * @param operand the offending operand.
 * @param message human-readable detail, naming both metric and operand.
 */
public record EvaluationDiagnostic(String metric, DiagnosticCode code, String operand, String message) {
}

package com.credit.modelengine.mode;

/**
 * @param reason which rule fired, for logs and responses.
 */
public record ModeDecision(EngineMode mode, String reason) {
}

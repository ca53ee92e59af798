package com.credit.modelengine;

/**
 * Total failure to load the facts of a deal, including a timeout. Nothing can
 * be computed, so this is surfaced to the caller.
 */
public class FactLoadException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String dealId;

    public FactLoadException(String dealId, Throwable cause) {
        super("Failed to load facts for deal " + dealId + ": " + cause.getMessage(), cause);
        this.dealId = dealId;
    }

    public String dealId() {
        return dealId;
    }
}

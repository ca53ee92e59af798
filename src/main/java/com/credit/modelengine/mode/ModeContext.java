package com.credit.modelengine.mode;

/**
 * Who is asking. Only privileged (operations or admin) callers may be routed to
 * anything but {@link EngineMode#PRIMARY}.
 */
public record ModeContext(boolean privileged, String dealId, String bankId) {

    public static ModeContext user(String dealId, String bankId) {
        return new ModeContext(false, dealId, bankId);
    }

    public static ModeContext ops(String dealId, String bankId) {
        return new ModeContext(true, dealId, bankId);
    }
}

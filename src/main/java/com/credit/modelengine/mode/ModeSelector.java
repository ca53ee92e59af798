package com.credit.modelengine.mode;

/**
 * Decides the authoritative path for a request. A pure function of its
 * arguments; it reads no ambient settings.
 *
 * <p>
 * Non-privileged callers always get {@link EngineMode#PRIMARY}. Privileged
 * callers resolve in order: global override, explicit mode, deal allowlist,
 * bank allowlist, default.
 */
public final class ModeSelector {

    public static final String REASON_ENFORCED = "enforced";
    public static final String REASON_GLOBAL_OVERRIDE = "global_override";
    public static final String REASON_EXPLICIT_MODE = "explicit_mode";
    public static final String REASON_DEAL_ALLOWLIST = "deal_allowlist";
    public static final String REASON_BANK_ALLOWLIST = "bank_allowlist";
    public static final String REASON_DEFAULT = "default";

    private ModeSelector() {
    }

    public static ModeDecision selectMode(ModeConfig config, ModeContext context) {
        if (context == null || !context.privileged())
            return new ModeDecision(EngineMode.PRIMARY, REASON_ENFORCED);
        if (config.globalOverride() != null)
            return new ModeDecision(config.globalOverride(), REASON_GLOBAL_OVERRIDE);
        if (config.explicitMode() != null)
            return new ModeDecision(config.explicitMode(), REASON_EXPLICIT_MODE);
        if (context.dealId() != null && config.dealAllowlist().contains(context.dealId()))
            return new ModeDecision(config.allowlistMode(), REASON_DEAL_ALLOWLIST);
        if (context.bankId() != null && config.bankAllowlist().contains(context.bankId()))
            return new ModeDecision(config.allowlistMode(), REASON_BANK_ALLOWLIST);
        return new ModeDecision(EngineMode.PRIMARY, REASON_DEFAULT);
    }
}

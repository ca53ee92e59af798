package com.credit.modelengine.mode;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mode selection configuration, passed explicitly into every selection.
 *
 * @param globalOverride wins over everything for privileged callers.
 * @param explicitMode   applies when no override is set.
 * @param dealAllowlist  deals routed to {@code allowlistMode}.
 * @param bankAllowlist  banks routed to {@code allowlistMode}.
 * @param allowlistMode  mode for allowlisted deals and banks.
 */
public record ModeConfig(
        EngineMode globalOverride,
        EngineMode explicitMode,
        Set<String> dealAllowlist,
        Set<String> bankAllowlist,
        EngineMode allowlistMode) {

    public static final String OVERRIDE_KEY = "MODEL_ENGINE_MODE_OVERRIDE";
    public static final String MODE_KEY = "MODEL_ENGINE_MODE";
    public static final String DEAL_ALLOWLIST_KEY = "MODEL_ENGINE_DEAL_ALLOWLIST";
    public static final String BANK_ALLOWLIST_KEY = "MODEL_ENGINE_BANK_ALLOWLIST";
    public static final String ALLOWLIST_MODE_KEY = "MODEL_ENGINE_ALLOWLIST_MODE";

    public static final ModeConfig DEFAULT = new ModeConfig(null, null, Set.of(), Set.of(), EngineMode.SHADOW);

    public ModeConfig {
        dealAllowlist = dealAllowlist == null ? Set.of() : Set.copyOf(dealAllowlist);
        bankAllowlist = bankAllowlist == null ? Set.of() : Set.copyOf(bankAllowlist);
        if (allowlistMode == null)
            allowlistMode = EngineMode.SHADOW;
    }

    /**
     * Parses environment-style settings. Allowlists are comma separated.
     *
     * @throws IllegalArgumentException on an unknown mode name.
     */
    public static ModeConfig fromProperties(Map<String, String> props) {
        return new ModeConfig(
                EngineMode.parse(props.get(OVERRIDE_KEY)),
                EngineMode.parse(props.get(MODE_KEY)),
                csv(props.get(DEAL_ALLOWLIST_KEY)),
                csv(props.get(BANK_ALLOWLIST_KEY)),
                EngineMode.parse(props.get(ALLOWLIST_MODE_KEY)));
    }

    public static ModeConfig fromEnvironment() {
        return fromProperties(System.getenv());
    }

    public ModeConfig withOverride(EngineMode mode) {
        return new ModeConfig(mode, explicitMode, dealAllowlist, bankAllowlist, allowlistMode);
    }

    public ModeConfig withExplicitMode(EngineMode mode) {
        return new ModeConfig(globalOverride, mode, dealAllowlist, bankAllowlist, allowlistMode);
    }

    private static Set<String> csv(String raw) {
        if (raw == null || raw.isBlank())
            return Set.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}

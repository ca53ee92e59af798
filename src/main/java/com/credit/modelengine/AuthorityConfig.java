package com.credit.modelengine;

import java.time.Duration;

import com.credit.modelengine.builder.BuilderConfig;
import com.credit.modelengine.parity.ParityThresholds;

/**
 * Settings of {@link EngineAuthority}.
 *
 * @param loadTimeout   bound on each fact or legacy rendering load.
 * @param policyVersion stamped on snapshots and renderings.
 */
public record AuthorityConfig(Duration loadTimeout, String policyVersion, BuilderConfig builderConfig,
        ParityThresholds parityThresholds) {

    public static final AuthorityConfig DEFAULT = new AuthorityConfig(Duration.ofSeconds(10), "policy-v1",
            BuilderConfig.DEFAULT, ParityThresholds.DEFAULT);

    public AuthorityConfig {
        if (loadTimeout == null || loadTimeout.isNegative() || loadTimeout.isZero())
            throw new IllegalArgumentException("loadTimeout must be positive: " + loadTimeout);
    }

    public AuthorityConfig withLoadTimeout(Duration timeout) {
        return new AuthorityConfig(timeout, policyVersion, builderConfig, parityThresholds);
    }

    public AuthorityConfig withPolicyVersion(String version) {
        return new AuthorityConfig(loadTimeout, version, builderConfig, parityThresholds);
    }
}

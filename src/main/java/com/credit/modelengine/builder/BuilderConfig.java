package com.credit.modelengine.builder;

import java.util.Set;

/**
 * Settings of the model builder.
 *
 * @param minYear        period end dates before this year are treated as placeholders.
 * @param sentinelDates  literal placeholder dates written by extractors for undated values.
 * @param balanceTolerance absolute rounding tolerance of the balance check.
 */
public record BuilderConfig(int minYear, Set<String> sentinelDates, double balanceTolerance) {

    public static final Set<String> DEFAULT_SENTINELS = Set.of("1900-01-01", "1970-01-01", "0001-01-01", "9999-12-31");

    public static final BuilderConfig DEFAULT = new BuilderConfig(1990, DEFAULT_SENTINELS, 1.0);

    public BuilderConfig {
        sentinelDates = Set.copyOf(sentinelDates);
        if (balanceTolerance < 0)
            throw new IllegalArgumentException("balanceTolerance must be >= 0: " + balanceTolerance);
    }

    public BuilderConfig withMinYear(int value) {
        return new BuilderConfig(value, sentinelDates, balanceTolerance);
    }
}

package com.credit.modelengine.parity;

/**
 * Alignment of one period end date across both sides.
 *
 * @param leftLabel  label of the legacy column, null when the legacy side has no such period.
 * @param rightLabel label of the model period, null when the model has no such period.
 */
public record PeriodAlignment(String periodEnd, String leftLabel, String rightLabel, Source source) {

    public enum Source {
        BOTH,
        LEFT_ONLY,
        RIGHT_ONLY
    }

    public boolean aligned() {
        return source == Source.BOTH;
    }
}

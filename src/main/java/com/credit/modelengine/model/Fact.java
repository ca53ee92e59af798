package com.credit.modelengine.model;

/**
 * Atomic dated numeric observation produced by the fact-extraction pipeline.
 *
 * <p>
 * A fact is immutable and treated as a point-in-time input. A {@code null}
 * value or an unusable period end date does not make the fact an error; the
 * model builder simply leaves it out.
 *
 * @param type       statement type that produced the fact (e.g. {@code BALANCE_SHEET}).
 * @param key        fact key within the statement (e.g. {@code TOTAL_ASSETS}).
 * @param value      numeric value, or {@code null} when extraction found none.
 * @param periodEnd  ISO {@code yyyy-MM-dd} period end, possibly a placeholder date.
 * @param confidence extraction confidence in [0, 1], optional.
 */
public record Fact(String type, String key, Double value, String periodEnd, Double confidence) {

    public static Fact of(String type, String key, double value, String periodEnd) {
        return new Fact(type, key, value, periodEnd, null);
    }
}

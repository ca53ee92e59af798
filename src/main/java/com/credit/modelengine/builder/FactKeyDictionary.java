package com.credit.modelengine.builder;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed mapping from extracted fact keys and statement types to model fields.
 *
 * <p>
 * Keys not listed here are ignored by the builder. Several extractor spellings
 * collapse onto the same field (e.g. {@code TOTAL_INCOME} and
 * {@code TOTAL_REVENUE}).
 */
public final class FactKeyDictionary {

    /** Statement types whose facts participate in modeling. */
    public static final Set<String> RELEVANT_TYPES = Set.of(
            "INCOME_STATEMENT", "BALANCE_SHEET", "CASH_FLOW", "T12", "TAX_RETURN", "FINANCIAL_ANALYSIS");

    /** Types emitted by the "current/undated" extraction pass; eligible for sentinel promotion. */
    public static final Set<String> PROMOTABLE_TYPES = Set.of(
            "INCOME_STATEMENT", "BALANCE_SHEET", "FINANCIAL_ANALYSIS");

    private static final Map<String, ModelField> KEYS;

    static {
        Map<String, ModelField> m = new HashMap<>();
        m.put("TOTAL_REVENUE", ModelField.REVENUE);
        m.put("TOTAL_INCOME", ModelField.REVENUE);
        m.put("GROSS_RECEIPTS", ModelField.REVENUE);
        m.put("GROSS_RENTAL_INCOME", ModelField.REVENUE);
        m.put("COST_OF_GOODS_SOLD", ModelField.COGS);
        m.put("TOTAL_OPERATING_EXPENSES", ModelField.OPERATING_EXPENSES);
        m.put("TOTAL_OPEX", ModelField.OPERATING_EXPENSES);
        m.put("DEPRECIATION", ModelField.DEPRECIATION);
        m.put("INTEREST_EXPENSE", ModelField.INTEREST);
        m.put("DEBT_SERVICE", ModelField.INTEREST);
        m.put("NET_INCOME", ModelField.NET_INCOME);

        m.put("CASH_AND_EQUIVALENTS", ModelField.CASH);
        m.put("ACCOUNTS_RECEIVABLE", ModelField.ACCOUNTS_RECEIVABLE);
        m.put("INVENTORY", ModelField.INVENTORY);
        m.put("TOTAL_CURRENT_ASSETS", ModelField.CURRENT_ASSETS);
        m.put("TOTAL_ASSETS", ModelField.TOTAL_ASSETS);
        m.put("SHORT_TERM_DEBT", ModelField.SHORT_TERM_DEBT);
        m.put("LONG_TERM_DEBT", ModelField.LONG_TERM_DEBT);
        m.put("TOTAL_CURRENT_LIABILITIES", ModelField.CURRENT_LIABILITIES);
        m.put("TOTAL_LIABILITIES", ModelField.TOTAL_LIABILITIES);
        m.put("TOTAL_EQUITY", ModelField.EQUITY);

        m.put("EBITDA", ModelField.EBITDA);
        m.put("CAPITAL_EXPENDITURES", ModelField.CAPEX);
        m.put("CAPEX", ModelField.CAPEX);
        KEYS = Collections.unmodifiableMap(m);
    }

    private FactKeyDictionary() {
    }

    public static Optional<ModelField> fieldFor(String factKey) {
        if (factKey == null)
            return Optional.empty();
        return Optional.ofNullable(KEYS.get(factKey));
    }

    public static boolean isRelevant(String factType) {
        return factType != null && RELEVANT_TYPES.contains(factType);
    }

    public static boolean isPromotable(String factType) {
        return factType != null && PROMOTABLE_TYPES.contains(factType);
    }
}

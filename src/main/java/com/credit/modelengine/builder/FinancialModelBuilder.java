package com.credit.modelengine.builder;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.credit.modelengine.model.BalanceSheet;
import com.credit.modelengine.model.CashFlow;
import com.credit.modelengine.model.Fact;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.model.FinancialPeriod;
import com.credit.modelengine.model.IncomeStatement;
import com.credit.modelengine.model.PeriodType;
import com.credit.modelengine.model.QualityFlag;

import lombok.extern.log4j.Log4j2;

/**
 * Folds dated numeric facts into per-period financial snapshots.
 *
 * <p>
 * Build pipeline:
 * <ol>
 * <li>Filter: keep relevant statement types with a numeric value and a usable date.</li>
 * <li>Group: one bucket per distinct period end date.</li>
 * <li>Promote: placeholder-dated facts of the undated statement pass are applied to
 * the latest real period, after its dated facts, so they win key collisions.</li>
 * <li>Map: fact keys land on fields through {@link FactKeyDictionary}.</li>
 * <li>Derive: EBITDA, equity and CFADS from values of the same period only.</li>
 * <li>Check: quality flags.</li>
 * </ol>
 *
 * <p>
 * The builder is pure. It reads no clock, performs no I/O, and the result does
 * not depend on the order of the input facts.
 */
@Log4j2
public final class FinancialModelBuilder {

    /**
     * Application order inside a period. Later facts overwrite earlier ones, so
     * the highest-confidence fact wins a collision.
     */
    static final Comparator<Fact> APPLY_ORDER = Comparator
            .comparing((Fact f) -> f.confidence() == null ? Double.NEGATIVE_INFINITY : f.confidence())
            .thenComparing(Fact::type)
            .thenComparing(Fact::key, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Fact::value);

    private enum DateClass {
        REAL, SENTINEL, INVALID
    }

    private final BuilderConfig config;

    public FinancialModelBuilder() {
        this(BuilderConfig.DEFAULT);
    }

    public FinancialModelBuilder(BuilderConfig config) {
        this.config = config;
    }

    /**
     * Builds the model for one deal from its full fact set.
     *
     * @param dealId deal identifier, used for period ids.
     * @param facts  every fact currently known for the deal.
     * @return periods sorted ascending by end date.
     */
    public FinancialModel build(String dealId, List<Fact> facts) {
        Map<String, List<Fact>> byPeriodEnd = new TreeMap<>();
        List<Fact> undated = new ArrayList<>();
        int skipped = 0;

        for (Fact fact : facts) {
            if (!FactKeyDictionary.isRelevant(fact.type()) || fact.value() == null || !Double.isFinite(fact.value())) {
                skipped++;
                continue;
            }
            String normalized = normalizeDate(fact.periodEnd());
            switch (classify(normalized)) {
                case REAL -> byPeriodEnd.computeIfAbsent(normalized, k -> new ArrayList<>()).add(fact);
                case SENTINEL -> {
                    if (FactKeyDictionary.isPromotable(fact.type()))
                        undated.add(fact);
                    else
                        skipped++;
                }
                case INVALID -> skipped++;
            }
        }

        // One bucket per normalized end date, so period ids are unique here.
        List<FinancialPeriod> periods = new ArrayList<>(byPeriodEnd.size());
        for (Map.Entry<String, List<Fact>> entry : byPeriodEnd.entrySet()) {
            String periodEnd = entry.getKey();
            FinancialPeriod period = new FinancialPeriod(dealId, periodEnd,
                    PeriodType.fromMonth(LocalDate.parse(periodEnd).getMonthValue()));
            applyFacts(period, entry.getValue());
            periods.add(period);
        }

        if (!undated.isEmpty()) {
            if (periods.isEmpty()) {
                log.debug("Deal {}: {} undated facts dropped, no dated period to attach to", dealId, undated.size());
            } else {
                FinancialPeriod latest = periods.get(periods.size() - 1);
                applyFacts(latest, undated);
                log.debug("Deal {}: promoted {} undated facts into {}", dealId, undated.size(), latest.getPeriodEnd());
            }
        }

        for (FinancialPeriod period : periods) {
            derive(period);
            checkQuality(period);
        }

        log.debug("Deal {}: built {} periods from {} facts ({} skipped)", dealId, periods.size(), facts.size(), skipped);
        return new FinancialModel(dealId, periods);
    }

    private void applyFacts(FinancialPeriod period, List<Fact> facts) {
        List<Fact> ordered = new ArrayList<>(facts);
        ordered.sort(APPLY_ORDER);
        for (Fact fact : ordered) {
            Optional<ModelField> field = FactKeyDictionary.fieldFor(fact.key());
            field.ifPresent(f -> f.set(period, fact.value()));
        }
    }

    static void derive(FinancialPeriod period) {
        IncomeStatement income = period.getIncome();
        BalanceSheet balance = period.getBalance();
        CashFlow cashflow = period.getCashflow();

        if (cashflow.getEbitda() == null && income.getRevenue() != null) {
            cashflow.setEbitda(income.getRevenue()
                    - orZero(income.getCogs())
                    - orZero(income.getOperatingExpenses())
                    + orZero(income.getDepreciation()));
        }
        if (balance.getEquity() == null && balance.getTotalAssets() != null && balance.getTotalLiabilities() != null) {
            balance.setEquity(balance.getTotalAssets() - balance.getTotalLiabilities());
        }
        if (cashflow.getCfads() == null && cashflow.getEbitda() != null) {
            cashflow.setCfads(cashflow.getEbitda() - orZero(cashflow.getCapex()));
        }
    }

    void checkQuality(FinancialPeriod period) {
        IncomeStatement income = period.getIncome();
        BalanceSheet balance = period.getBalance();

        if (balance.getTotalAssets() != null && balance.getTotalLiabilities() != null && balance.getEquity() != null) {
            double gap = balance.getTotalAssets() - (balance.getTotalLiabilities() + balance.getEquity());
            if (Math.abs(gap) > config.balanceTolerance())
                period.addFlag(QualityFlag.BALANCE_SHEET_IMBALANCE);
        }
        if (income.getRevenue() == null)
            period.addFlag(QualityFlag.MISSING_REVENUE);
        else if (income.getRevenue() < 0)
            period.addFlag(QualityFlag.NEGATIVE_REVENUE);
        if (balance.getTotalAssets() == null)
            period.addFlag(QualityFlag.MISSING_TOTAL_ASSETS);
    }

    private DateClass classify(String isoDate) {
        if (isoDate == null)
            return DateClass.INVALID;
        if (config.sentinelDates().contains(isoDate))
            return DateClass.SENTINEL;
        LocalDate date;
        try {
            date = LocalDate.parse(isoDate);
        } catch (DateTimeParseException e) {
            return DateClass.INVALID;
        }
        return date.getYear() < config.minYear() ? DateClass.SENTINEL : DateClass.REAL;
    }

    /** Trims timestamps down to their date part; {@code null} for blank input. */
    static String normalizeDate(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String trimmed = raw.trim();
        return trimmed.length() > 10 && trimmed.charAt(10) == 'T' ? trimmed.substring(0, 10) : trimmed;
    }

    private static double orZero(Double v) {
        return v == null ? 0.0 : v;
    }
}

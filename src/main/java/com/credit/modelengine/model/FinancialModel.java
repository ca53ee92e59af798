package com.credit.modelengine.model;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical, hashable output of a model build: the periods of one deal sorted
 * ascending by end date. Period ids are unique within a model.
 */
public record FinancialModel(String dealId, List<FinancialPeriod> periods) {

    public FinancialModel {
        periods = List.copyOf(periods);
        Set<String> ids = new HashSet<>();
        for (FinancialPeriod period : periods)
            if (!ids.add(period.getPeriodId()))
                throw new IllegalArgumentException("Duplicate period id: " + period.getPeriodId());
    }

    /** The most recent period, if any. */
    public Optional<FinancialPeriod> latestPeriod() {
        return periods.isEmpty() ? Optional.empty() : Optional.of(periods.get(periods.size() - 1));
    }

    public Optional<FinancialPeriod> period(String periodEnd) {
        return periods.stream().filter(p -> p.getPeriodEnd().equals(periodEnd)).findFirst();
    }
}

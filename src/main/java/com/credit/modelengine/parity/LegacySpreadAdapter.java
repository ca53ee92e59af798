package com.credit.modelengine.parity;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Normalizes legacy renderings into {@link PeriodMetrics}.
 *
 * <p>
 * Only discrete period-end columns take part; aggregate columns (TTM, YTD, prior
 * YTD) are dropped. Several renderings of the same deal (income statement and
 * balance sheet) merge into one entry per end date. Leverage is derived per
 * period from that period's debt rows and EBITDA.
 */
@Log4j2
public final class LegacySpreadAdapter {

    static final Set<String> AGGREGATE_KINDS = Set.of("ttm", "ytd", "prior_ytd");
    static final String SECTION_HEADER = "section_header";

    private static final Pattern AGGREGATE_LABEL = Pattern.compile("^(TTM|YTD|PY.YTD)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_LABEL = Pattern
            .compile("^(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+(\\d{4})$");
    private static final List<String> MONTHS = List.of(
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec");

    private static final Map<String, ParityMetric> ROW_KEYS = Map.ofEntries(
            Map.entry("TOTAL_REVENUE", ParityMetric.REVENUE),
            Map.entry("TOTAL_INCOME", ParityMetric.REVENUE),
            Map.entry("GROSS_RENTAL_INCOME", ParityMetric.REVENUE),
            Map.entry("COST_OF_GOODS_SOLD", ParityMetric.COGS),
            Map.entry("TOTAL_OPEX", ParityMetric.OPERATING_EXPENSES),
            Map.entry("TOTAL_OPERATING_EXPENSES", ParityMetric.OPERATING_EXPENSES),
            Map.entry("EBITDA", ParityMetric.EBITDA),
            Map.entry("NOI", ParityMetric.EBITDA),
            Map.entry("NET_INCOME", ParityMetric.NET_INCOME),
            Map.entry("CASH_AND_EQUIVALENTS", ParityMetric.CASH),
            Map.entry("TOTAL_ASSETS", ParityMetric.TOTAL_ASSETS),
            Map.entry("TOTAL_LIABILITIES", ParityMetric.TOTAL_LIABILITIES),
            Map.entry("TOTAL_EQUITY", ParityMetric.EQUITY));

    private static final String SHORT_TERM_DEBT = "SHORT_TERM_DEBT";
    private static final String LONG_TERM_DEBT = "LONG_TERM_DEBT";

    private LegacySpreadAdapter() {
    }

    public static List<PeriodMetrics> adapt(List<LegacySpread> spreads) {
        Map<String, Accumulator> byEnd = new TreeMap<>();

        for (LegacySpread spread : spreads) {
            if (spread == null || spread.getRows() == null) {
                log.debug("Legacy rendering without rows skipped");
                continue;
            }
            List<LegacySpread.Column> discrete = discreteColumns(spread);
            for (LegacySpread.Column column : discrete) {
                String end = endDate(column);
                Accumulator acc = byEnd.computeIfAbsent(end, k -> new Accumulator(column.getLabel()));
                for (LegacySpread.Row row : spread.getRows()) {
                    if (row == null || SECTION_HEADER.equals(row.getNotes()) || row.getKey() == null)
                        continue;
                    Double value = cellValue(row, column, discrete.size());
                    if (value == null || !Double.isFinite(value))
                        continue;
                    switch (row.getKey()) {
                        case SHORT_TERM_DEBT -> acc.shortTermDebt = value;
                        case LONG_TERM_DEBT -> acc.longTermDebt = value;
                        default -> {
                            ParityMetric metric = ROW_KEYS.get(row.getKey());
                            if (metric != null)
                                acc.metrics.put(metric, value);
                        }
                    }
                }
            }
        }

        List<PeriodMetrics> out = new ArrayList<>(byEnd.size());
        for (Map.Entry<String, Accumulator> e : byEnd.entrySet()) {
            Accumulator acc = e.getValue();
            Double ebitda = acc.metrics.get(ParityMetric.EBITDA);
            if ((acc.shortTermDebt != null || acc.longTermDebt != null) && ebitda != null && ebitda != 0.0) {
                double debt = orZero(acc.shortTermDebt) + orZero(acc.longTermDebt);
                acc.metrics.put(ParityMetric.LEVERAGE_DEBT_TO_EBITDA, debt / ebitda);
            }
            out.add(new PeriodMetrics(e.getKey(), acc.label, acc.metrics));
        }
        return out;
    }

    /** Columns with a resolvable end date that are not aggregates. */
    static List<LegacySpread.Column> discreteColumns(LegacySpread spread) {
        List<LegacySpread.Column> discrete = new ArrayList<>();
        if (spread.getColumns() == null)
            return discrete;
        for (LegacySpread.Column column : spread.getColumns()) {
            if (column == null || isAggregate(column))
                continue;
            if (endDate(column) == null) {
                log.debug("Legacy column {} has no resolvable end date, skipped", column.getKey());
                continue;
            }
            discrete.add(column);
        }
        return discrete;
    }

    static boolean isAggregate(LegacySpread.Column column) {
        if (column.getKind() != null && AGGREGATE_KINDS.contains(column.getKind().toLowerCase(Locale.ROOT)))
            return true;
        String label = column.getLabel() != null ? column.getLabel() : column.getKey();
        return label != null && AGGREGATE_LABEL.matcher(label.trim()).matches();
    }

    static String endDate(LegacySpread.Column column) {
        if (column.getEndDate() != null && !column.getEndDate().isBlank())
            return column.getEndDate().length() > 10 ? column.getEndDate().substring(0, 10) : column.getEndDate();
        String label = column.getLabel() != null ? column.getLabel() : column.getKey();
        return label == null ? null : inferEndDate(label.trim());
    }

    /** {@code "Dec 2024"} to {@code "2024-12-31"}; null when the label is not a month label. */
    static String inferEndDate(String label) {
        Matcher m = MONTH_LABEL.matcher(label);
        if (!m.matches())
            return null;
        YearMonth ym = YearMonth.of(Integer.parseInt(m.group(2)), MONTHS.indexOf(m.group(1)) + 1);
        return ym.atEndOfMonth().toString();
    }

    private static Double cellValue(LegacySpread.Row row, LegacySpread.Column column, int discreteCount) {
        if (row.getValues() != null && !row.getValues().isEmpty())
            return row.getValues().get(column.getKey());
        // A scalar cannot be attributed to one of several periods.
        return discreteCount == 1 ? row.getValue() : null;
    }

    private static double orZero(Double v) {
        return v == null ? 0.0 : v;
    }

    private static final class Accumulator {
        final String label;
        final Map<ParityMetric, Double> metrics = new EnumMap<>(ParityMetric.class);
        Double shortTermDebt;
        Double longTermDebt;

        Accumulator(String label) {
            this.label = label;
        }
    }
}

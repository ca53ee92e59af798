package com.credit.modelengine.parity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import com.credit.modelengine.model.FinancialModel;

import lombok.extern.log4j.Log4j2;

/**
 * Compares a legacy rendering (left) against the model (right).
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Align periods by end date. Legacy-only periods are errors, model-only
 * periods are warnings.</li>
 * <li>For every aligned period and every dictionary metric reported by both
 * sides, compute the delta, materiality and threshold level and run the
 * anomaly checks. A metric reported by one side only becomes a note and a
 * missing-row warning.</li>
 * <li>Check headline metrics against the headline tolerance.</li>
 * <li>Derive the gate verdict and overall pass/fail.</li>
 * </ol>
 *
 * <p>
 * Pure: reports leave {@code generatedAt} unset for the caller to stamp. Never
 * throws on value differences; every anomaly is reported as a flag.
 */
@Log4j2
public final class ParityEngine {

    /** Absolute materiality floor in currency units. */
    public static final double MATERIAL_ABS = 1.0;
    /** Relative materiality floor, against {@code max(1, |left|)}. */
    public static final double MATERIAL_REL = 0.0001;

    public ParityReport compare(String dealId, List<LegacySpread> legacy, FinancialModel model,
            ParityThresholds thresholds) {
        return compare(dealId, LegacySpreadAdapter.adapt(legacy), ModelParityAdapter.adapt(model), thresholds);
    }

    public ParityReport compare(String dealId, List<PeriodMetrics> left, List<PeriodMetrics> right) {
        return compare(dealId, left, right, ParityThresholds.DEFAULT);
    }

    public ParityReport compare(String dealId, List<PeriodMetrics> left, List<PeriodMetrics> right,
            ParityThresholds thresholds) {
        Map<String, PeriodMetrics> leftByEnd = index(left);
        Map<String, PeriodMetrics> rightByEnd = index(right);

        TreeSet<String> ends = new TreeSet<>(leftByEnd.keySet());
        ends.addAll(rightByEnd.keySet());

        List<PeriodAlignment> alignments = new ArrayList<>(ends.size());
        List<MetricDiff> diffs = new ArrayList<>();
        List<HeadlineCheck> headline = new ArrayList<>();
        List<ParityFlag> flags = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        for (String end : ends) {
            PeriodMetrics l = leftByEnd.get(end);
            PeriodMetrics r = rightByEnd.get(end);
            if (r == null) {
                alignments.add(new PeriodAlignment(end, l.label(), null, PeriodAlignment.Source.LEFT_ONLY));
                flags.add(new ParityFlag(FlagType.MISSING_PERIOD, Severity.ERROR, null, end,
                        "Period " + end + " exists in the legacy rendering but not in the model"));
                continue;
            }
            if (l == null) {
                alignments.add(new PeriodAlignment(end, null, r.label(), PeriodAlignment.Source.RIGHT_ONLY));
                flags.add(new ParityFlag(FlagType.MISSING_PERIOD, Severity.WARNING, null, end,
                        "Period " + end + " exists in the model but not in the legacy rendering"));
                continue;
            }
            alignments.add(new PeriodAlignment(end, l.label(), r.label(), PeriodAlignment.Source.BOTH));
            comparePeriod(end, l, r, thresholds, diffs, headline, flags, notes);
        }

        ParityReport.Summary summary = summarize(diffs);
        GateVerdict verdict = verdict(diffs, flags);
        boolean passed = passed(verdict, headline, flags, thresholds);

        ParityReport report = new ParityReport(dealId, null, alignments, diffs, headline,
                flags, notes, summary, verdict, passed, thresholds);
        log.info("Parity {}: verdict={} passed={} periods={} material={} flags={}", dealId, verdict, passed,
                alignments.size(), summary.materialCount(), flags.size());
        return report;
    }

    private static void comparePeriod(String end, PeriodMetrics l, PeriodMetrics r, ParityThresholds thresholds,
            List<MetricDiff> diffs, List<HeadlineCheck> headline, List<ParityFlag> flags, List<String> notes) {
        for (ParityMetric metric : ParityMetric.values()) {
            Double lv = l.get(metric);
            Double rv = r.get(metric);

            if (lv != null && rv != null) {
                MetricDiff diff = diff(metric, end, lv, rv, thresholds);
                diffs.add(diff);
                detectAnomalies(metric, end, lv, rv, flags);
                if (metric.headline())
                    headline.add(headlineCheck(metric, end, diff, thresholds));
                continue;
            }

            if (lv != null || rv != null) {
                String side = lv == null ? "legacy rendering" : "model";
                String note = metric.label() + " missing in " + side + " for " + end;
                notes.add(note);
                flags.add(new ParityFlag(FlagType.MISSING_ROW, Severity.WARNING, metric.key(), end, note));
            }
            if (metric.headline())
                headline.add(new HeadlineCheck(metric, end, lv, rv, null, null, true));
        }
    }

    static MetricDiff diff(ParityMetric metric, String end, double left, double right, ParityThresholds thresholds) {
        double delta = right - left;
        double pct = pctDelta(left, delta);
        DiffLevel level = thresholds.forCategory(metric.category()).level(Math.abs(delta), Math.abs(pct));
        return new MetricDiff(metric, end, left, right, delta, pct, isMaterial(left, delta), level);
    }

    /** {@code delta / |left|}; infinite when left is zero and delta is not, 0 when both are zero. */
    static double pctDelta(double left, double delta) {
        if (left != 0.0)
            return delta / Math.abs(left);
        return delta == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, delta);
    }

    public static boolean isMaterial(double left, double delta) {
        double abs = Math.abs(delta);
        return abs > MATERIAL_ABS || abs / Math.max(1.0, Math.abs(left)) > MATERIAL_REL;
    }

    static void detectAnomalies(ParityMetric metric, String end, double left, double right, List<ParityFlag> flags) {
        if ((left > 0 && right < 0) || (left < 0 && right > 0)) {
            flags.add(new ParityFlag(FlagType.SIGN_FLIP, Severity.ERROR, metric.key(), end,
                    metric.label() + ": legacy=" + left + ", model=" + right + " for " + end));
        }
        if (left != 0.0 && right != 0.0) {
            double ratio = Math.abs(left / right);
            if ((ratio > 900 && ratio < 1100) || (ratio > 0.0009 && ratio < 0.0011)) {
                flags.add(new ParityFlag(FlagType.SCALING_ERROR, Severity.ERROR, metric.key(), end,
                        metric.label() + ": legacy=" + left + " vs model=" + right + " (~1000x) for " + end));
            }
        }
        if ((left == 0.0) != (right == 0.0)) {
            String zeroSide = left == 0.0 ? "legacy" : "model";
            flags.add(new ParityFlag(FlagType.ZERO_FILL, Severity.WARNING, metric.key(), end,
                    metric.label() + ": " + zeroSide + " is 0, other side " + (left == 0.0 ? right : left)
                            + " for " + end));
        }
    }

    private static HeadlineCheck headlineCheck(ParityMetric metric, String end, MetricDiff diff,
            ParityThresholds thresholds) {
        boolean within = Math.abs(diff.delta()) <= thresholds.headlineAbsTolerance()
                || Math.abs(diff.pctDelta()) <= thresholds.headlinePctTolerance();
        return new HeadlineCheck(metric, end, diff.left(), diff.right(), diff.delta(), diff.pctDelta(), within);
    }

    private static ParityReport.Summary summarize(List<MetricDiff> diffs) {
        int total = 0, material = 0;
        double maxAbs = 0.0;
        for (MetricDiff d : diffs) {
            if (d.delta() != 0.0)
                total++;
            if (d.material())
                material++;
            maxAbs = Math.max(maxAbs, Math.abs(d.delta()));
        }
        return new ParityReport.Summary(total, material, material > 0, maxAbs);
    }

    static GateVerdict verdict(List<MetricDiff> diffs, List<ParityFlag> flags) {
        if (diffs.stream().anyMatch(d -> d.level() == DiffLevel.BLOCK))
            return GateVerdict.BLOCK;
        boolean material = diffs.stream().anyMatch(MetricDiff::material);
        boolean missingPeriod = flags.stream()
                .anyMatch(f -> f.type() == FlagType.MISSING_PERIOD && f.severity() == Severity.ERROR);
        return material || missingPeriod ? GateVerdict.WARN : GateVerdict.PASS;
    }

    static boolean passed(GateVerdict verdict, List<HeadlineCheck> headline, List<ParityFlag> flags,
            ParityThresholds thresholds) {
        if (verdict == GateVerdict.BLOCK)
            return false;
        if (headline.stream().anyMatch(h -> !h.withinTolerance()))
            return false;
        return flags.stream()
                .filter(f -> f.severity() == Severity.ERROR)
                .noneMatch(f -> f.type() != FlagType.MISSING_PERIOD || thresholds.missingPeriodFails());
    }

    private static Map<String, PeriodMetrics> index(List<PeriodMetrics> periods) {
        Map<String, PeriodMetrics> byEnd = new LinkedHashMap<>();
        for (PeriodMetrics p : periods) {
            if (byEnd.putIfAbsent(p.periodEnd(), p) != null)
                log.warn("Duplicate parity period {} ignored", p.periodEnd());
        }
        return byEnd;
    }
}

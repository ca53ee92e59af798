package com.credit.modelengine.parity;

import java.util.Locale;

/**
 * Renders a {@link ParityReport} as Markdown for audit and operations review.
 */
public final class ParityReportFormatter {

    private ParityReportFormatter() {
    }

    public static String toMarkdown(ParityReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Parity report: ").append(report.dealId()).append('\n').append('\n');
        sb.append("- Verdict: **").append(report.verdict()).append("**\n");
        sb.append("- Result: **").append(report.passed() ? "PASS" : "FAIL").append("**\n");
        ParityReport.Summary s = report.summary();
        sb.append("- Differences: ").append(s.totalDifferences())
                .append(", material: ").append(s.materialCount())
                .append(", max |delta|: ").append(number(s.maxAbsDelta())).append("\n\n");

        sb.append("## Period alignment\n\n");
        sb.append("| Period end | Legacy | Model | Source |\n|---|---|---|---|\n");
        for (PeriodAlignment a : report.periods()) {
            sb.append("| ").append(a.periodEnd())
                    .append(" | ").append(dash(a.leftLabel()))
                    .append(" | ").append(dash(a.rightLabel()))
                    .append(" | ").append(a.source()).append(" |\n");
        }

        sb.append("\n## Headline metrics\n\n");
        sb.append("| Metric | Period | Legacy | Model | Delta | Status |\n|---|---|---|---|---|---|\n");
        for (HeadlineCheck h : report.headline()) {
            sb.append("| ").append(h.metric().label())
                    .append(" | ").append(h.periodEnd())
                    .append(" | ").append(number(h.left()))
                    .append(" | ").append(number(h.right()))
                    .append(" | ").append(number(h.delta()))
                    .append(" | ").append(h.withinTolerance() ? "ok" : "**FAIL**").append(" |\n");
        }

        sb.append("\n## Material mismatches\n\n");
        long material = report.diffs().stream().filter(MetricDiff::material).count();
        if (material == 0) {
            sb.append("None.\n");
        } else {
            sb.append("| Metric | Period | Legacy | Model | Delta | Pct | Level |\n|---|---|---|---|---|---|---|\n");
            for (MetricDiff d : report.diffs()) {
                if (!d.material())
                    continue;
                sb.append("| ").append(d.metric().label())
                        .append(" | ").append(d.periodEnd())
                        .append(" | ").append(number(d.left()))
                        .append(" | ").append(number(d.right()))
                        .append(" | ").append(number(d.delta()))
                        .append(" | ").append(percent(d.pctDelta()))
                        .append(" | ").append(d.level()).append(" |\n");
            }
        }

        sb.append("\n## Flags\n\n");
        if (report.flags().isEmpty())
            sb.append("None.\n");
        for (ParityFlag f : report.flags())
            sb.append("- [").append(f.severity()).append("] ").append(f.type()).append(": ").append(f.detail())
                    .append('\n');

        if (!report.notes().isEmpty()) {
            sb.append("\n## Notes\n\n");
            for (String note : report.notes())
                sb.append("- ").append(note).append('\n');
        }
        return sb.toString();
    }

    private static String dash(String s) {
        return s == null ? "-" : s;
    }

    private static String number(Double v) {
        if (v == null)
            return "-";
        if (v == Math.rint(v) && Math.abs(v) < 1e15)
            return String.format(Locale.US, "%,.0f", v);
        return String.format(Locale.US, "%,.4f", v);
    }

    private static String percent(double v) {
        if (Double.isInfinite(v))
            return v > 0 ? "+inf" : "-inf";
        return String.format(Locale.US, "%.4f%%", v * 100);
    }
}

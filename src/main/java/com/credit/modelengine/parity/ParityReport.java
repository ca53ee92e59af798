package com.credit.modelengine.parity;

import java.util.List;

/**
 * Result of a parity comparison. {@code generatedAt} is informational, stamped
 * by the caller, and excluded from content hashes.
 */
public record ParityReport(
        String dealId,
        String generatedAt,
        List<PeriodAlignment> periods,
        List<MetricDiff> diffs,
        List<HeadlineCheck> headline,
        List<ParityFlag> flags,
        List<String> notes,
        Summary summary,
        GateVerdict verdict,
        boolean passed,
        ParityThresholds thresholdsUsed) {

    public ParityReport {
        periods = List.copyOf(periods);
        diffs = List.copyOf(diffs);
        headline = List.copyOf(headline);
        flags = List.copyOf(flags);
        notes = List.copyOf(notes);
    }

    /**
     * @param totalDifferences diffs with a non-zero delta.
     * @param materialCount    diffs passing the materiality test.
     * @param maxAbsDelta      largest absolute delta, 0 when nothing was diffed.
     */
    public record Summary(int totalDifferences, int materialCount, boolean materiallyDifferent, double maxAbsDelta) {
    }

    public ParityReport withGeneratedAt(String timestamp) {
        return new ParityReport(dealId, timestamp, periods, diffs, headline, flags, notes, summary, verdict, passed,
                thresholdsUsed);
    }

    public List<ParityFlag> flagsOf(FlagType type) {
        return flags.stream().filter(f -> f.type() == type).toList();
    }

    public boolean hasErrors() {
        return flags.stream().anyMatch(f -> f.severity() == Severity.ERROR);
    }
}

package com.credit.modelengine.parity;

/**
 * WARN and BLOCK levels of one metric category. A level is crossed when either
 * the absolute or the percentage delta exceeds it.
 */
public record CategoryThreshold(double warnAbs, double warnPct, double blockAbs, double blockPct) {

    public CategoryThreshold {
        if (warnAbs < 0 || warnPct < 0 || blockAbs < warnAbs || blockPct < warnPct)
            throw new IllegalArgumentException("BLOCK thresholds must be non-negative and no looser than WARN: "
                    + warnAbs + "/" + warnPct + " vs " + blockAbs + "/" + blockPct);
    }

    public DiffLevel level(double absDelta, double absPctDelta) {
        if (absDelta > blockAbs || absPctDelta > blockPct)
            return DiffLevel.BLOCK;
        if (absDelta > warnAbs || absPctDelta > warnPct)
            return DiffLevel.WARN;
        return DiffLevel.NONE;
    }
}

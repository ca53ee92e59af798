package com.credit.modelengine.risk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Applies risk rules to computed metrics. A metric that could not be computed
 * never raises a flag.
 */
@Log4j2
public final class RiskEvaluator {

    public static final List<RiskRule> DEFAULT_RULES = List.of(
            new RiskRule("DSCR_BELOW_MIN", "DSCR", RiskRule.Comparison.BELOW, 1.25, RiskSeverity.HIGH),
            new RiskRule("LEVERAGE_ABOVE_MAX", "LEVERAGE", RiskRule.Comparison.ABOVE, 4.0, RiskSeverity.HIGH),
            new RiskRule("CURRENT_RATIO_BELOW_MIN", "CURRENT_RATIO", RiskRule.Comparison.BELOW, 1.0, RiskSeverity.MEDIUM),
            new RiskRule("NEGATIVE_NET_MARGIN", "NET_MARGIN", RiskRule.Comparison.BELOW, 0.0, RiskSeverity.MEDIUM));

    private final List<RiskRule> rules;

    public RiskEvaluator() {
        this(DEFAULT_RULES);
    }

    public RiskEvaluator(List<RiskRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<RiskFlag> evaluate(Map<String, Double> metrics) {
        List<RiskFlag> flags = new ArrayList<>();
        for (RiskRule rule : rules) {
            RiskFlag flag = rule.apply(metrics.get(rule.metric()));
            if (flag != null)
                flags.add(flag);
        }
        if (!flags.isEmpty())
            log.debug("{} risk flags raised: {}", flags.size(), flags.stream().map(RiskFlag::code).toList());
        return flags;
    }

    public List<RiskRule> rules() {
        return rules;
    }
}

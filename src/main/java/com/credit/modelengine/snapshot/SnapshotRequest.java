package com.credit.modelengine.snapshot;

import java.util.List;
import java.util.Map;

import com.credit.modelengine.model.Fact;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.risk.RiskFlag;

/**
 * Everything a snapshot is derived from. Version stamps and the dependency
 * graph may be null for callers that do not track them.
 */
public record SnapshotRequest(
        String dealId,
        String bankId,
        List<Fact> facts,
        FinancialModel model,
        Map<String, Double> metrics,
        List<RiskFlag> riskFlags,
        String registryVersion,
        String policyVersion,
        Map<String, List<String>> dependencyGraph,
        String engineSource) {

    public SnapshotRequest {
        facts = facts == null ? List.of() : facts;
        riskFlags = riskFlags == null ? List.of() : riskFlags;
        dependencyGraph = dependencyGraph == null ? Map.of() : dependencyGraph;
    }
}

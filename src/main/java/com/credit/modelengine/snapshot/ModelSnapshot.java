package com.credit.modelengine.snapshot;

import java.util.List;
import java.util.Map;

import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.risk.RiskFlag;

/**
 * Immutable, content-addressed record of one authoritative computation.
 *
 * @param outputsHash     digest of model, metrics and risk flags; the dedup key per deal.
 * @param snapshotHash    digest of facts, model, metrics and version stamps; used for replay.
 * @param dependencyGraph realized dependencies of every metric.
 * @param engineSource    which path produced the snapshot, e.g. {@code model}.
 */
public record ModelSnapshot(
        String id,
        String dealId,
        String bankId,
        String outputsHash,
        String snapshotHash,
        String registryVersion,
        String policyVersion,
        String engineSource,
        FinancialModel model,
        Map<String, Double> metrics,
        List<RiskFlag> riskFlags,
        Map<String, List<String>> dependencyGraph,
        String createdAt) {
}

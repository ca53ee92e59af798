package com.credit.modelengine;

import java.util.List;
import java.util.Map;

import com.credit.modelengine.engine.EvaluationDiagnostic;
import com.credit.modelengine.model.Fact;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.render.SpreadViewModel;
import com.credit.modelengine.risk.RiskFlag;

/**
 * Outcome of one model computation.
 *
 * @param snapshotId null when persistence was skipped or failed.
 * @param persisted  whether both snapshot and rendering writes succeeded.
 */
public record AuthoritativeResult(
        String dealId,
        String bankId,
        List<Fact> facts,
        FinancialModel model,
        Map<String, Double> metrics,
        Map<String, List<String>> dependencyGraph,
        List<EvaluationDiagnostic> diagnostics,
        List<RiskFlag> riskFlags,
        SpreadViewModel view,
        String outputsHash,
        String snapshotHash,
        String snapshotId,
        boolean persisted) {
}

package com.credit.modelengine;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import com.credit.modelengine.api.FactSource;
import com.credit.modelengine.api.LegacySpreadSource;
import com.credit.modelengine.builder.BaseValueExtractor;
import com.credit.modelengine.builder.FinancialModelBuilder;
import com.credit.modelengine.engine.MetricGraphEvaluator;
import com.credit.modelengine.io.MetricRegistry;
import com.credit.modelengine.mode.EngineMode;
import com.credit.modelengine.mode.ModeConfig;
import com.credit.modelengine.mode.ModeContext;
import com.credit.modelengine.mode.ModeDecision;
import com.credit.modelengine.mode.ModeSelector;
import com.credit.modelengine.model.Fact;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.parity.LegacySpread;
import com.credit.modelengine.parity.ParityEngine;
import com.credit.modelengine.parity.ParityReport;
import com.credit.modelengine.render.ModelViewRenderer;
import com.credit.modelengine.render.SpreadViewModel;
import com.credit.modelengine.risk.RiskEvaluator;
import com.credit.modelengine.risk.RiskFlag;
import com.credit.modelengine.snapshot.ModelSnapshot;
import com.credit.modelengine.snapshot.RenderingRecord;
import com.credit.modelengine.snapshot.RenderingStore;
import com.credit.modelengine.snapshot.SnapshotRequest;
import com.credit.modelengine.snapshot.SnapshotService;
import com.credit.modelengine.util.DiagnosticsTrackingListener;
import com.credit.modelengine.util.MetricGraphExplain;

import lombok.extern.log4j.Log4j2;

/**
 * The single path allowed to persist snapshots and current renderings.
 *
 * <p>
 * One computation runs facts → model → metrics → hashes → risk → view model →
 * snapshot → current rendering. Only a fact load failure or a cyclic registry
 * is surfaced to the caller; a failed audit write is logged and the computed
 * result is still returned.
 *
 * <p>
 * Calls are independent and may run concurrently for the same or different
 * deals.
 */
@Log4j2
public final class EngineAuthority {

    public static final String ENGINE_SOURCE = "model";

    private final FactSource factSource;
    private final LegacySpreadSource legacySource;
    private final MetricRegistry registry;
    private final SnapshotService snapshots;
    private final RenderingStore renderings;
    private final AuthorityConfig config;
    private final FinancialModelBuilder builder;
    private final RiskEvaluator riskEvaluator = new RiskEvaluator();
    private final ModelViewRenderer renderer;
    private final ParityEngine parityEngine;
    private final Clock clock;

    public EngineAuthority(FactSource factSource, LegacySpreadSource legacySource, MetricRegistry registry,
            SnapshotService snapshots, RenderingStore renderings, AuthorityConfig config) {
        this(factSource, legacySource, registry, snapshots, renderings, config, Clock.systemUTC());
    }

    public EngineAuthority(FactSource factSource, LegacySpreadSource legacySource, MetricRegistry registry,
            SnapshotService snapshots, RenderingStore renderings, AuthorityConfig config, Clock clock) {
        this.factSource = factSource;
        this.legacySource = legacySource;
        this.registry = registry;
        this.snapshots = snapshots;
        this.renderings = renderings;
        this.config = config;
        this.clock = clock;
        this.builder = new FinancialModelBuilder(config.builderConfig());
        this.renderer = new ModelViewRenderer(clock);
        this.parityEngine = new ParityEngine();
    }

    /**
     * Computes and persists the authoritative model of a deal.
     *
     * @throws FactLoadException if the facts cannot be loaded in time.
     */
    public AuthoritativeResult computeAuthoritative(String dealId, String bankId) {
        return compute(dealId, bankId, true);
    }

    /** Computes without any write. */
    public AuthoritativeResult computeReadOnly(String dealId, String bankId) {
        return compute(dealId, bankId, false);
    }

    /**
     * Serves a request according to the selected mode.
     * <ul>
     * <li>{@code LEGACY}: the model is computed read-only.</li>
     * <li>{@code SHADOW}: computed, persisted and compared with the legacy rendering.</li>
     * <li>{@code PRIMARY}: computed and persisted.</li>
     * </ul>
     */
    public ServedResult serve(String dealId, String bankId, ModeConfig modeConfig, ModeContext context) {
        ModeDecision decision = ModeSelector.selectMode(modeConfig, context);
        log.debug("Deal {}: mode {} ({})", dealId, decision.mode(), decision.reason());

        if (decision.mode() == EngineMode.LEGACY)
            return new ServedResult(decision, computeReadOnly(dealId, bankId), null);

        AuthoritativeResult result = computeAuthoritative(dealId, bankId);
        ParityReport parity = decision.mode() == EngineMode.SHADOW ? shadowCompare(dealId, bankId, result.model())
                : null;
        return new ServedResult(decision, result, parity);
    }

    private AuthoritativeResult compute(String dealId, String bankId, boolean persist) {
        List<Fact> facts = loadFacts(dealId);
        FinancialModel model = builder.build(dealId, facts);

        MetricGraphEvaluator evaluator = new MetricGraphEvaluator();
        DiagnosticsTrackingListener diagnostics = new DiagnosticsTrackingListener(dealId);
        evaluator.setListener(diagnostics);
        MetricGraphEvaluator.AuditResult audit = evaluator.evaluateWithAudit(registry.metrics(),
                BaseValueExtractor.extract(model));
        Map<String, Double> metrics = audit.values();
        if (log.isTraceEnabled())
            log.trace("Deal {} metric graph:\n{}", dealId,
                    new MetricGraphExplain(registry.metrics(), metrics, audit.dependencyGraph()).dumpTopology());

        List<RiskFlag> riskFlags = riskEvaluator.evaluate(metrics);
        String outputsHash = snapshots.outputsHash(model, metrics, riskFlags);
        String snapshotHash = snapshots.snapshotHash(facts, model, metrics, registry.version(),
                config.policyVersion());
        SpreadViewModel view = renderer.render(model, registry);

        String snapshotId = null;
        boolean persisted = false;
        if (persist) {
            snapshotId = persistSnapshot(dealId, bankId, facts, model, metrics, riskFlags, audit.dependencyGraph());
            boolean rendered = persistRendering(dealId, bankId, outputsHash, snapshotHash, audit.dependencyGraph(),
                    view);
            persisted = snapshotId != null && rendered;
        }

        log.info("Deal {}: {} periods, {} metrics, {} risk flags, snapshot {}", dealId, model.periods().size(),
                registry.size(), riskFlags.size(), snapshotId);
        return new AuthoritativeResult(dealId, bankId, facts, model, metrics, audit.dependencyGraph(),
                diagnostics.diagnostics(), riskFlags, view, outputsHash, snapshotHash, snapshotId, persisted);
    }

    private List<Fact> loadFacts(String dealId) {
        try {
            List<Fact> facts = withTimeout(factSource.loadFacts(dealId)).join();
            return facts == null ? List.of() : facts;
        } catch (CompletionException e) {
            throw new FactLoadException(dealId, e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            throw new FactLoadException(dealId, e);
        }
    }

    private String persistSnapshot(String dealId, String bankId, List<Fact> facts, FinancialModel model,
            Map<String, Double> metrics, List<RiskFlag> riskFlags, Map<String, List<String>> dependencyGraph) {
        try {
            ModelSnapshot snapshot = snapshots.persist(new SnapshotRequest(dealId, bankId, facts, model, metrics,
                    riskFlags, registry.version(), config.policyVersion(), dependencyGraph, ENGINE_SOURCE));
            return snapshot.id();
        } catch (RuntimeException e) {
            log.warn("Deal {}: snapshot persist failed, continuing without snapshot", dealId, e);
            return null;
        }
    }

    private boolean persistRendering(String dealId, String bankId, String outputsHash, String snapshotHash,
            Map<String, List<String>> dependencyGraph, SpreadViewModel view) {
        try {
            renderings.upsert(new RenderingRecord(dealId, bankId, RenderingRecord.STANDARD_STATEMENT,
                    RenderingRecord.SCHEMA_VERSION, registry.version(), config.policyVersion(), outputsHash,
                    snapshotHash, dependencyGraph, view, Instant.now(clock).toString()));
            return true;
        } catch (RuntimeException e) {
            log.warn("Deal {}: rendering persist failed", dealId, e);
            return false;
        }
    }

    private ParityReport shadowCompare(String dealId, String bankId, FinancialModel model) {
        List<LegacySpread> spreads;
        try {
            spreads = withTimeout(legacySource.loadSpreads(dealId, bankId)).join();
        } catch (RuntimeException e) {
            log.warn("Deal {}: legacy rendering unavailable, shadow comparison skipped", dealId, e);
            return null;
        }
        ParityReport report;
        try {
            report = parityEngine.compare(dealId, spreads == null ? List.of() : spreads, model,
                    config.parityThresholds()).withGeneratedAt(Instant.now(clock).toString());
        } catch (RuntimeException e) {
            log.warn("Deal {}: legacy rendering could not be compared, shadow comparison skipped", dealId, e);
            return null;
        }
        if (!report.passed())
            log.warn("Deal {}: shadow parity failed, verdict {}", dealId, report.verdict());
        return report;
    }

    private <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future) {
        return future.orTimeout(config.loadTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }
}

package com.credit.modelengine.snapshot;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.credit.modelengine.builder.BaseValueExtractor;
import com.credit.modelengine.builder.FinancialModelBuilder;
import com.credit.modelengine.engine.MetricGraphEvaluator;
import com.credit.modelengine.io.MetricRegistry;
import com.credit.modelengine.model.Fact;
import com.credit.modelengine.model.FinancialModel;

import lombok.extern.log4j.Log4j2;

/**
 * Recomputes a stored snapshot from facts and checks that the snapshot hash
 * reproduces. Version stamps are compared first, since a different registry or
 * policy version cannot be expected to reproduce the hash.
 */
@Log4j2
public final class ReplayVerifier {

    public enum Status {
        MATCH,
        HASH_MISMATCH,
        SNAPSHOT_NOT_FOUND,
        MODEL_REGISTRY_VERSION_MISMATCH,
        MODEL_POLICY_VERSION_MISMATCH
    }

    public record ReplayResult(String snapshotId, Status status, String expectedHash, String actualHash,
            String detail) {
        public boolean matched() {
            return status == Status.MATCH;
        }
    }

    private final SnapshotStore store;
    private final SnapshotService snapshots;
    private final FinancialModelBuilder builder;
    private final MetricGraphEvaluator evaluator = new MetricGraphEvaluator();

    public ReplayVerifier(SnapshotStore store, SnapshotService snapshots, FinancialModelBuilder builder) {
        this.store = store;
        this.snapshots = snapshots;
        this.builder = builder;
    }

    public ReplayResult replay(String snapshotId, List<Fact> facts, MetricRegistry registry, String policyVersion) {
        Optional<ModelSnapshot> found = store.findById(snapshotId);
        if (found.isEmpty())
            return new ReplayResult(snapshotId, Status.SNAPSHOT_NOT_FOUND, null, null,
                    "No snapshot with id " + snapshotId);
        ModelSnapshot snapshot = found.get();

        if (!Objects.equals(snapshot.registryVersion(), registry.version()))
            return new ReplayResult(snapshotId, Status.MODEL_REGISTRY_VERSION_MISMATCH, snapshot.snapshotHash(), null,
                    "Snapshot registry " + snapshot.registryVersion() + ", replay registry " + registry.version());
        if (!Objects.equals(snapshot.policyVersion(), policyVersion))
            return new ReplayResult(snapshotId, Status.MODEL_POLICY_VERSION_MISMATCH, snapshot.snapshotHash(), null,
                    "Snapshot policy " + snapshot.policyVersion() + ", replay policy " + policyVersion);

        FinancialModel model = builder.build(snapshot.dealId(), facts);
        Map<String, Double> metrics = evaluator.evaluate(registry.metrics(), BaseValueExtractor.extract(model));
        String actual = snapshots.snapshotHash(facts, model, metrics, registry.version(), policyVersion);

        if (actual.equals(snapshot.snapshotHash())) {
            log.info("Replay of {} reproduced hash", snapshotId);
            return new ReplayResult(snapshotId, Status.MATCH, snapshot.snapshotHash(), actual, "Hash reproduced");
        }
        log.warn("Replay of {} diverged: expected {} got {}", snapshotId, snapshot.snapshotHash(), actual);
        return new ReplayResult(snapshotId, Status.HASH_MISMATCH, snapshot.snapshotHash(), actual,
                "Recomputed snapshot hash differs");
    }
}

package com.credit.modelengine.snapshot;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.credit.modelengine.hash.CanonicalHasher;
import com.credit.modelengine.model.Fact;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.risk.RiskFlag;

import lombok.extern.log4j.Log4j2;

/**
 * Persists content-addressed snapshots.
 *
 * <p>
 * Re-running a computation on unchanged inputs is a storage no-op: the outputs
 * hash is computed first, and an existing snapshot with the same deal and hash
 * is returned without writing. Two writers racing past that check are settled by
 * the store's uniqueness constraint; the loser gets the winner's snapshot.
 */
@Log4j2
public final class SnapshotService {

    public static final String DEFAULT_SOURCE = "model";

    /** Canonical fact order for hashing, so input order never affects the digest. */
    static final Comparator<Fact> FACT_ORDER = Comparator
            .comparing(Fact::type, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Fact::key, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Fact::periodEnd, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Fact::value, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Fact::confidence, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final SnapshotStore store;
    private final CanonicalHasher hasher;
    private final Supplier<String> ids;
    private final Clock clock;

    public SnapshotService(SnapshotStore store) {
        this(store, new CanonicalHasher(), () -> UUID.randomUUID().toString(), Clock.systemUTC());
    }

    public SnapshotService(SnapshotStore store, CanonicalHasher hasher, Supplier<String> ids, Clock clock) {
        this.store = store;
        this.hasher = hasher;
        this.ids = ids;
        this.clock = clock;
    }

    /** @return id of the new or already existing snapshot. */
    public String persist(String dealId, String bankId, FinancialModel model, Map<String, Double> computedMetrics,
            List<RiskFlag> riskFlags) {
        return persist(new SnapshotRequest(dealId, bankId, null, model, computedMetrics, riskFlags, null, null, null,
                DEFAULT_SOURCE)).id();
    }

    public ModelSnapshot persist(SnapshotRequest request) {
        String outputsHash = outputsHash(request.model(), request.metrics(), request.riskFlags());
        Optional<ModelSnapshot> existing = store.findByOutputsHash(request.dealId(), outputsHash);
        if (existing.isPresent()) {
            log.debug("Deal {}: outputs {} unchanged, reusing snapshot {}", request.dealId(), shortHash(outputsHash),
                    existing.get().id());
            return existing.get();
        }

        String snapshotHash = snapshotHash(request.facts(), request.model(), request.metrics(),
                request.registryVersion(), request.policyVersion());
        ModelSnapshot candidate = new ModelSnapshot(ids.get(), request.dealId(), request.bankId(), outputsHash,
                snapshotHash, request.registryVersion(), request.policyVersion(),
                request.engineSource() == null ? DEFAULT_SOURCE : request.engineSource(), request.model(),
                request.metrics(), List.copyOf(request.riskFlags()), request.dependencyGraph(),
                Instant.now(clock).toString());

        ModelSnapshot stored = store.insertIfAbsent(candidate);
        if (stored != candidate)
            log.info("Deal {}: concurrent snapshot {} won for outputs {}", request.dealId(), stored.id(),
                    shortHash(outputsHash));
        else
            log.info("Deal {}: snapshot {} written (outputs {})", request.dealId(), stored.id(),
                    shortHash(outputsHash));
        return stored;
    }

    public String outputsHash(FinancialModel model, Map<String, Double> metrics, List<RiskFlag> riskFlags) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("computedMetrics", metrics);
        payload.put("riskFlags", riskFlags == null ? List.of() : riskFlags);
        return hasher.hash(payload);
    }

    public String snapshotHash(List<Fact> facts, FinancialModel model, Map<String, Double> metrics,
            String registryVersion, String policyVersion) {
        List<Fact> ordered = new ArrayList<>(facts == null ? List.of() : facts);
        ordered.sort(FACT_ORDER);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("facts", ordered);
        payload.put("model", model);
        payload.put("metrics", metrics);
        payload.put("registryVersion", registryVersion);
        payload.put("policyVersion", policyVersion);
        return hasher.hash(payload);
    }

    private static String shortHash(String hash) {
        return hash.substring(0, 12);
    }
}

package com.credit.modelengine.snapshot;

import java.util.List;
import java.util.Optional;

/**
 * Append-only snapshot storage. Implementations must enforce uniqueness on
 * {@code (dealId, outputsHash)}; that constraint, not the lookup before the
 * write, decides which of two concurrent writers wins.
 */
public interface SnapshotStore {

    Optional<ModelSnapshot> findByOutputsHash(String dealId, String outputsHash);

    /**
     * Inserts unless a snapshot with the same deal and outputs hash exists.
     *
     * @return the stored snapshot, which is the existing one if the insert lost.
     */
    ModelSnapshot insertIfAbsent(ModelSnapshot snapshot);

    Optional<ModelSnapshot> findById(String id);

    /** Snapshots of a deal, oldest first. */
    List<ModelSnapshot> listForDeal(String dealId);
}

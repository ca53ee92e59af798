package com.credit.modelengine.snapshot;

import java.util.Optional;

/** Holds one current rendering per (deal, bank, statement type). */
public interface RenderingStore {

    /** Inserts or replaces the rendering for the record's deal, bank and statement type. */
    void upsert(RenderingRecord record);

    Optional<RenderingRecord> find(String dealId, String bankId, String statementType);
}

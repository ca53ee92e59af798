package com.credit.modelengine.snapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** {@link RenderingStore} backed by a concurrent map. */
public final class InMemoryRenderingStore implements RenderingStore {

    private record Key(String dealId, String bankId, String statementType) {
    }

    private final Map<Key, RenderingRecord> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(RenderingRecord record) {
        records.put(new Key(record.dealId(), record.bankId(), record.statementType()), record);
    }

    @Override
    public Optional<RenderingRecord> find(String dealId, String bankId, String statementType) {
        return Optional.ofNullable(records.get(new Key(dealId, bankId, statementType)));
    }

    public int size() {
        return records.size();
    }
}

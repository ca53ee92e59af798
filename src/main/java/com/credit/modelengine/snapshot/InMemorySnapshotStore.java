package com.credit.modelengine.snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link SnapshotStore} backed by concurrent maps. */
public final class InMemorySnapshotStore implements SnapshotStore {

    private record ContentKey(String dealId, String outputsHash) {
    }

    private final Map<ContentKey, ModelSnapshot> byContent = new ConcurrentHashMap<>();
    private final Map<String, ModelSnapshot> byId = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<ModelSnapshot> log = new ConcurrentLinkedQueue<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public Optional<ModelSnapshot> findByOutputsHash(String dealId, String outputsHash) {
        return Optional.ofNullable(byContent.get(new ContentKey(dealId, outputsHash)));
    }

    @Override
    public ModelSnapshot insertIfAbsent(ModelSnapshot snapshot) {
        ModelSnapshot existing = byContent.putIfAbsent(new ContentKey(snapshot.dealId(), snapshot.outputsHash()),
                snapshot);
        if (existing != null)
            return existing;
        byId.put(snapshot.id(), snapshot);
        log.add(snapshot);
        writes.incrementAndGet();
        return snapshot;
    }

    @Override
    public Optional<ModelSnapshot> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<ModelSnapshot> listForDeal(String dealId) {
        List<ModelSnapshot> out = new ArrayList<>();
        for (ModelSnapshot s : log)
            if (s.dealId().equals(dealId))
                out.add(s);
        return out;
    }

    /** Number of snapshots actually written. */
    public int writeCount() {
        return writes.get();
    }
}

package com.credit.modelengine.snapshot;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class InMemoryRenderingStoreTest {

    private static RenderingRecord record(String dealId, String outputsHash) {
        return new RenderingRecord(dealId, "B1", RenderingRecord.STANDARD_STATEMENT, RenderingRecord.SCHEMA_VERSION,
                "v1", "policy-v1", outputsHash, "snap", Map.of(), null, "2025-01-01T00:00:00Z");
    }

    @Test
    public void testUpsertReplaces() {
        InMemoryRenderingStore store = new InMemoryRenderingStore();
        store.upsert(record("D1", "h1"));
        store.upsert(record("D1", "h2"));
        store.upsert(record("D2", "h3"));

        assertEquals(2, store.size());
        assertEquals("h2", store.find("D1", "B1", RenderingRecord.STANDARD_STATEMENT).orElseThrow().outputsHash());
        assertTrue(store.find("D1", "B2", RenderingRecord.STANDARD_STATEMENT).isEmpty());
    }
}

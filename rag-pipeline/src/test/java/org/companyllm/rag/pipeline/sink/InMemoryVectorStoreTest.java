package org.companyllm.rag.pipeline.sink;

import java.util.Map;

import org.companyllm.rag.pipeline.ir.IndexEntry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorStoreTest {

    private static IndexEntry entry(String id, float... vector) {
        return new IndexEntry(id, "hash-" + id, vector, "text " + id, Map.of());
    }

    @Test
    void queryOrdersByScoreThenChunkId() {
        var store = new InMemoryVectorStore();
        store.upsert(entry("b", 1, 0));
        store.upsert(entry("a", 1, 0));
        store.upsert(entry("c", 0, 1));
        store.upsert(entry("d", 1, 1));

        var hits = store.query(new float[] {1, 0}, 3);

        assertEquals(3, hits.size());
        assertEquals("a", hits.get(0).chunkId());
        assertEquals("b", hits.get(1).chunkId());
        assertEquals("d", hits.get(2).chunkId());
        assertEquals(1.0, hits.get(0).score(), 1e-9);
    }

    @Test
    void queryReturnsAtMostStoredEntries() {
        var store = new InMemoryVectorStore();
        store.upsert(entry("a", 1, 0));
        store.upsert(entry("b", 0, 1));

        assertEquals(2, store.query(new float[] {1, 0}, 3).size());
        assertTrue(store.query(new float[] {1, 0}, 0).isEmpty());
    }

    @Test
    void upsertOverwritesByChunkId() {
        var store = new InMemoryVectorStore("kb");
        store.upsert(entry("a", 1, 0));
        store.upsert(new IndexEntry("a", "new-hash", new float[] {0, 1}, "new text", Map.of()));

        assertEquals("new-hash", store.get("a").orElseThrow().contentHash());
        assertEquals(new StoreStats("kb", 1, "memory"), store.stats());
        assertEquals(2, store.getUpsertCount());
    }

    @Test
    void dimensionMismatchIsRejected() {
        var store = new InMemoryVectorStore();
        store.upsert(entry("a", 1, 0, 0));

        assertThrows(IllegalArgumentException.class, () -> store.query(new float[] {1, 0}, 1));
    }

    @Test
    void zeroVectorScoresZero() {
        assertEquals(0.0, VectorMath.cosine(new float[] {0, 0}, new float[] {1, 0}));
        assertEquals(-1.0, VectorMath.cosine(new float[] {1, 0}, new float[] {-2, 0}), 1e-9);
    }
}

package org.companyllm.rag.pipeline.sink;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.companyllm.rag.pipeline.ir.IndexEntry;
import org.companyllm.rag.pipeline.ir.SearchHit;

/**
 * Vector store held entirely in memory with exhaustive cosine search.
 *
 * Used directly by tests and as the query engine of the file-backed store. The
 * upsert counter lets tests assert on how many writes a run performed.
 */
public class InMemoryVectorStore implements VectorStore {
    public static final Comparator<SearchHit> BY_SCORE_THEN_ID = Comparator
        .comparingDouble(SearchHit::score).reversed()
        .thenComparing(SearchHit::chunkId);

    private final String name;
    private final Map<String, IndexEntry> entries = new ConcurrentHashMap<>();
    private long upserts;

    public InMemoryVectorStore() {
        this("in-memory");
    }

    public InMemoryVectorStore(String name) {
        this.name = name;
    }

    @Override
    public Optional<IndexEntry> get(String chunkId) {
        return Optional.ofNullable(entries.get(chunkId));
    }

    @Override
    public synchronized void upsert(IndexEntry entry) {
        entries.put(entry.chunkId(), entry);
        upserts++;
    }

    @Override
    public List<SearchHit> query(float[] vector, int k) {
        if (k <= 0) {
            return List.of();
        }
        return entries.values().stream()
            .map(entry -> new SearchHit(entry, VectorMath.cosine(vector, entry.vector())))
            .sorted(BY_SCORE_THEN_ID)
            .limit(k)
            .collect(Collectors.toList());
    }

    @Override
    public StoreStats stats() {
        return new StoreStats(name, entries.size(), "memory");
    }

    public Collection<IndexEntry> getEntries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public synchronized long getUpsertCount() {
        return upserts;
    }

    /** Replace the whole content, e.g. when loading from disk. Not counted as upserts. */
    public void load(Collection<IndexEntry> loaded) {
        entries.clear();
        loaded.forEach(entry -> entries.put(entry.chunkId(), entry));
    }

    public void clear() {
        entries.clear();
    }
}

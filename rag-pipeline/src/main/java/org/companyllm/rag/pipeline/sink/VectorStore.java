package org.companyllm.rag.pipeline.sink;

import java.util.List;
import java.util.Optional;

import org.companyllm.rag.pipeline.ir.IndexEntry;
import org.companyllm.rag.pipeline.ir.SearchHit;

/**
 * Port for the persisted vector index. Upsert-by-key is atomic per entry; there are
 * no cross-entry transactions. Storage failures surface as
 * {@link org.companyllm.rag.pipeline.error.IndexWriteException}.
 */
public interface VectorStore extends AutoCloseable {

    Optional<IndexEntry> get(String chunkId);

    /** Insert or overwrite the entry for {@code entry.chunkId()}. */
    void upsert(IndexEntry entry);

    /** The {@code k} entries most similar to {@code vector}, highest score first. */
    List<SearchHit> query(float[] vector, int k);

    StoreStats stats();

    @Override
    default void close() {
        // Default no-op
    }
}

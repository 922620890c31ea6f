package org.companyllm.rag.store;

import java.util.Map;

import org.companyllm.rag.pipeline.ir.IndexEntry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of the collection log.
 */
@JsonPropertyOrder({"chunk_id", "content_hash", "text", "metadata", "vector"})
record StoredEntry(
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("content_hash") String contentHash,
    @JsonProperty("text") String text,
    @JsonProperty("metadata") Map<String, String> metadata,
    @JsonProperty("vector") float[] vector
) {
    static StoredEntry from(IndexEntry entry) {
        return new StoredEntry(entry.chunkId(), entry.contentHash(), entry.text(), entry.metadata(), entry.vector());
    }

    /** Entries missing their key, hash or vector cannot be trusted for change detection. */
    boolean isComplete() {
        return chunkId != null && !chunkId.isBlank() && contentHash != null && vector != null && vector.length > 0;
    }

    IndexEntry toIndexEntry() {
        return new IndexEntry(chunkId, contentHash, vector, text == null ? "" : text, metadata);
    }
}

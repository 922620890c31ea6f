package org.companyllm.rag.pipeline.ir;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state for one chunk id. The hash and the vector are always written together.
 */
public record IndexEntry(
    String chunkId,
    String contentHash,
    float[] vector,
    String text,
    Map<String, String> metadata
) {
    public IndexEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static IndexEntry of(Chunk chunk, float[] vector) {
        return new IndexEntry(chunk.chunkId(), chunk.contentHash(), vector, chunk.text(), chunk.metadata());
    }

    public Chunk toChunk() {
        return new Chunk(chunkId, text, contentHash, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexEntry)) {
            return false;
        }
        var other = (IndexEntry) o;
        return Objects.equals(chunkId, other.chunkId)
            && Objects.equals(contentHash, other.contentHash)
            && Arrays.equals(vector, other.vector)
            && Objects.equals(text, other.text)
            && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkId, contentHash, Arrays.hashCode(vector), text, metadata);
    }

    @Override
    public String toString() {
        return "IndexEntry[chunkId=" + chunkId + ", contentHash=" + contentHash
            + ", dimensions=" + (vector == null ? 0 : vector.length) + "]";
    }
}

package org.companyllm.rag.pipeline.ir;

import java.util.Map;

/**
 * A bounded text window of a document; the unit of embedding and retrieval.
 */
public record Chunk(
    String chunkId,
    String text,
    String contentHash,
    Map<String, String> metadata
) {
    public static final String CHUNK_INDEX_KEY = "chunk_index";

    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static String idFor(String documentId, int chunkIndex) {
        return documentId + "-chunk-" + chunkIndex;
    }
}

package org.companyllm.rag.pipeline.chunking;

/**
 * What {@code chunkSize} and {@code chunkOverlap} are measured in.
 */
public enum ChunkUnit {
    /** Windows over the raw characters of the body. */
    CHARACTERS,
    /** Windows over whitespace-separated words, re-joined with single spaces. */
    WORDS
}

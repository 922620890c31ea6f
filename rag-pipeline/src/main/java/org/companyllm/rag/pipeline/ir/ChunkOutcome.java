package org.companyllm.rag.pipeline.ir;

/**
 * Emitted by the upserter once per chunk, after its effect (if any) is persisted.
 */
public record ChunkOutcome(String chunkId, UpsertOutcome outcome) {}

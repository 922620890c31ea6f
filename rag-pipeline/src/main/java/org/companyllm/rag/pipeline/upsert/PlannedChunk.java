package org.companyllm.rag.pipeline.upsert;

import org.companyllm.rag.pipeline.ir.Chunk;
import org.companyllm.rag.pipeline.ir.UpsertOutcome;

/**
 * A chunk together with the outcome decided by comparing its hash with the store.
 * {@code NEW} and {@code UPDATED} chunks still need an embedding.
 */
record PlannedChunk(Chunk chunk, UpsertOutcome plannedOutcome) {
    boolean needsEmbedding() {
        return plannedOutcome != UpsertOutcome.SKIPPED;
    }
}

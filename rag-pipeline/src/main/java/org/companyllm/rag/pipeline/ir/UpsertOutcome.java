package org.companyllm.rag.pipeline.ir;

public enum UpsertOutcome {
    /** First sighting of the chunk id: embedded and inserted. */
    NEW,
    /** Stored hash differed: re-embedded and overwritten. */
    UPDATED,
    /** Stored hash matched: no embedding call, no write. */
    SKIPPED,
    /** Embedding failed: nothing written for this chunk. */
    FAILED
}

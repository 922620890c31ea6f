package org.companyllm.rag.pipeline.upsert;

import java.util.function.Predicate;

/**
 * Batch boundary for {@code bufferUntil}: closes a batch once it holds the maximum
 * number of chunks, or once the text still to be embedded reaches the character limit.
 * A skipped chunk arriving while nothing waits for an embedding is released on its own.
 * Stateful, so use one instance per subscription.
 */
class EmbeddingBatchPredicate implements Predicate<PlannedChunk> {
    private final int maxChunks;
    private final long maxChars;
    private int currentCount;
    private int currentPending;
    private long currentChars;

    EmbeddingBatchPredicate(int maxChunks, long maxChars) {
        this.maxChunks = maxChunks;
        this.maxChars = maxChars;
    }

    @Override
    public boolean test(PlannedChunk planned) {
        if (!planned.needsEmbedding() && currentPending == 0) {
            reset();
            return true;
        }
        currentCount++;
        if (planned.needsEmbedding()) {
            currentPending++;
            currentChars += planned.chunk().text().length();
        }

        if (currentCount >= maxChunks || currentChars >= maxChars) {
            reset();
            return true;
        }
        return false;
    }

    private void reset() {
        currentCount = 0;
        currentPending = 0;
        currentChars = 0;
    }
}

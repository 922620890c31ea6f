package org.companyllm.rag.pipeline.upsert;

import java.time.Duration;

import org.companyllm.rag.pipeline.error.ConfigurationException;

import lombok.Builder;
import lombok.Value;

/**
 * Batching and timeout limits for embedding calls.
 */
@Value
@Builder
public class UpsertConfig {
    @Builder.Default
    int maxChunksPerBatch = 64;
    @Builder.Default
    long maxCharsPerBatch = 200_000;
    @Builder.Default
    Duration embeddingTimeout = Duration.ofSeconds(60);

    public UpsertConfig validate() {
        if (maxChunksPerBatch <= 0) {
            throw new ConfigurationException("maxChunksPerBatch must be positive, was " + maxChunksPerBatch);
        }
        if (maxCharsPerBatch <= 0) {
            throw new ConfigurationException("maxCharsPerBatch must be positive, was " + maxCharsPerBatch);
        }
        if (embeddingTimeout == null || embeddingTimeout.isNegative() || embeddingTimeout.isZero()) {
            throw new ConfigurationException("embeddingTimeout must be positive");
        }
        return this;
    }

    public static UpsertConfig defaults() {
        return builder().build();
    }
}

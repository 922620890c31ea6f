package org.companyllm.rag.pipeline.retrieval;

import org.companyllm.rag.pipeline.error.ConfigurationException;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RetrievalConfig {
    @Builder.Default
    int topK = 3;
    /** Upper bound on the characters of all document blocks in one prompt. */
    @Builder.Default
    int maxContextChars = 12_000;

    public RetrievalConfig validate() {
        if (topK <= 0) {
            throw new ConfigurationException("topK must be positive, was " + topK);
        }
        if (maxContextChars <= 0) {
            throw new ConfigurationException("maxContextChars must be positive, was " + maxContextChars);
        }
        return this;
    }

    public static RetrievalConfig defaults() {
        return builder().build();
    }
}

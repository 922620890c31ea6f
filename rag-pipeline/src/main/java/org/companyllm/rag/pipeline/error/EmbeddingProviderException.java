package org.companyllm.rag.pipeline.error;

/**
 * The embedding provider failed for a batch. Chunks of that batch are counted as failed.
 */
public class EmbeddingProviderException extends RagPipelineException {
    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

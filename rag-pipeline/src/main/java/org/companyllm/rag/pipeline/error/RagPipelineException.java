package org.companyllm.rag.pipeline.error;

/**
 * Base type for every failure the ingestion and retrieval pipeline reports.
 */
public class RagPipelineException extends RuntimeException {
    public RagPipelineException(String message) {
        super(message);
    }

    public RagPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}

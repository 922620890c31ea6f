package org.companyllm.rag.pipeline.error;

/**
 * The vector store could not be read or written. Fatal for the whole run, since
 * new/updated/skipped decisions cannot be trusted without the store.
 */
public class IndexWriteException extends RagPipelineException {
    public IndexWriteException(String message) {
        super(message);
    }

    public IndexWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.companyllm.rag.pipeline.error;

/**
 * A raw record lacks the minimum fields needed to build a canonical document.
 * The record is skipped and logged; the run continues.
 */
public class MalformedRecordException extends RagPipelineException {
    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}

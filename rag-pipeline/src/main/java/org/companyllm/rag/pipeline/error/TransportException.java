package org.companyllm.rag.pipeline.error;

/**
 * Network, auth or timeout failure while talking to a provider.
 * Aborts the pagination of the source it was raised for; other sources keep running.
 */
public class TransportException extends RagPipelineException {
    private final int statusCode;

    public TransportException(String message) {
        this(message, -1, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}

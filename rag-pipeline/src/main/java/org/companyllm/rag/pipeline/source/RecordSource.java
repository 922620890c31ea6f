package org.companyllm.rag.pipeline.source;

import org.companyllm.rag.pipeline.ir.RawRecord;

import reactor.core.publisher.Flux;

/**
 * Port for reading raw records from one collaboration system (or a replayed extract).
 */
public interface RecordSource extends AutoCloseable {

    /** Name used in logs and run reports. */
    String name();

    /**
     * Lazily stream every record of this source. The Flux is cold: each subscription
     * restarts pagination from the first page. A transport failure terminates the
     * Flux with a {@link org.companyllm.rag.pipeline.error.TransportException}; records
     * emitted before it remain valid.
     */
    Flux<RawRecord> readRecords();

    @Override
    default void close() throws Exception {
        // Default no-op for sources that don't hold resources
    }
}

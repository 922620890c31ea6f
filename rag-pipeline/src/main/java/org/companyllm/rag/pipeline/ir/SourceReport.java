package org.companyllm.rag.pipeline.ir;

/**
 * Per-source outcome of a run. {@code failure} is null when the source completed.
 */
public record SourceReport(
    String sourceName,
    long recordsRead,
    long documents,
    long malformedRecords,
    String failure
) {
    public boolean completed() {
        return failure == null;
    }
}

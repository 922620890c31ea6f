package org.companyllm.rag.pipeline.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Final tally of one pipeline run. {@code skipped} counts unchanged chunks,
 * {@code failed} counts chunks that could not be processed.
 */
@JsonPropertyOrder({"new", "updated", "skipped", "failed"})
public record IngestionSummary(
    @JsonProperty("new") long newCount,
    @JsonProperty("updated") long updated,
    @JsonProperty("skipped") long skipped,
    @JsonProperty("failed") long failed
) {
    public long total() {
        return newCount + updated + skipped + failed;
    }

    @Override
    public String toString() {
        return "{new: " + newCount + ", updated: " + updated + ", skipped: " + skipped + ", failed: " + failed + "}";
    }
}

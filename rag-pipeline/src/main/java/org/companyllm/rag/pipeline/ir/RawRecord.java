package org.companyllm.rag.pipeline.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Provider-native record tagged with the source it came from. The payload is
 * opaque to everything except the normalizer registered for that source.
 *
 * Values gathered during extraction that are not part of the provider's own
 * object (project key, channel name, fetched comments) live under {@link #CONTEXT_FIELD}.
 */
@JsonPropertyOrder({"source", "record"})
public record RawRecord(
    @JsonProperty("source") SourceType source,
    @JsonProperty("record") ObjectNode payload
) {
    public static final String CONTEXT_FIELD = "_context";

    public RawRecord {
        if (source == null || payload == null) {
            throw new IllegalArgumentException("Both source and payload must be provided");
        }
    }

    /** Extraction context, or a missing node when none was attached. */
    public JsonNode context() {
        return payload.path(CONTEXT_FIELD);
    }

    /** Adds an extraction context entry, creating the context object on first use. */
    public RawRecord withContext(String key, JsonNode value) {
        var copy = payload.deepCopy();
        var ctx = copy.has(CONTEXT_FIELD) && copy.get(CONTEXT_FIELD).isObject()
            ? (ObjectNode) copy.get(CONTEXT_FIELD)
            : copy.putObject(CONTEXT_FIELD);
        ctx.set(key, value);
        return new RawRecord(source, copy);
    }
}

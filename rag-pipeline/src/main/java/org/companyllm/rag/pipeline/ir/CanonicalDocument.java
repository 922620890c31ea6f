package org.companyllm.rag.pipeline.ir;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;

/**
 * Provider-agnostic form of one source record. {@code (source, externalId)} identifies
 * the document across ingestion runs.
 */
@Builder
public record CanonicalDocument(
    SourceType source,
    String externalId,
    String title,
    String body,
    Map<String, String> metadata,
    Instant updatedAt
) {
    public CanonicalDocument {
        if (source == null || externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("source and externalId are required");
        }
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Stable identifier used as the prefix of every chunk id, e.g. {@code jira-10042}. */
    public String documentId() {
        return source.wireName() + "-" + externalId;
    }

    /** Absent when the provider did not report a modification time. */
    public Optional<Instant> lastUpdated() {
        return Optional.ofNullable(updatedAt);
    }
}

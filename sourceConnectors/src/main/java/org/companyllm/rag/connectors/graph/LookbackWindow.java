package org.companyllm.rag.connectors.graph;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.companyllm.rag.connectors.text.Timestamps;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client-side modification-time filter for Graph items.
 */
class LookbackWindow {
    private final Instant cutoff;

    private LookbackWindow(Instant cutoff) {
        this.cutoff = cutoff;
    }

    static LookbackWindow of(Integer lookbackDays, Clock clock) {
        return new LookbackWindow(lookbackDays == null ? null : clock.instant().minus(Duration.ofDays(lookbackDays)));
    }

    /** Items without a parseable modification time are kept. */
    boolean includes(JsonNode item) {
        if (cutoff == null) {
            return true;
        }
        var modified = Timestamps.parseLenient(item.path("lastModifiedDateTime").asText(null))
            .or(() -> Timestamps.parseLenient(item.path("createdDateTime").asText(null)));
        return modified.map(ts -> !ts.isBefore(cutoff)).orElse(true);
    }
}

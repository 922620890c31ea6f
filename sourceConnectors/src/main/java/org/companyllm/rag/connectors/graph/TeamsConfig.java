package org.companyllm.rag.connectors.graph;

import java.time.Clock;
import java.util.List;

import org.companyllm.rag.pipeline.error.ConfigurationException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TeamsConfig {
    /** Teams to ingest by display name; when empty every team is discovered. */
    @Singular
    List<String> teamNames;
    /** Only messages modified within this many days; null for all time. */
    Integer lookbackDays;
    @Builder.Default
    Clock clock = Clock.systemUTC();

    public TeamsConfig validate() {
        if (lookbackDays != null && lookbackDays <= 0) {
            throw new ConfigurationException("Teams lookbackDays must be positive, was " + lookbackDays);
        }
        return this;
    }
}

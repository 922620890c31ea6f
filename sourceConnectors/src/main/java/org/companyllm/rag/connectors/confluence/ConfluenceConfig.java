package org.companyllm.rag.connectors.confluence;

import java.util.List;

import org.companyllm.rag.pipeline.error.ConfigurationException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ConfluenceConfig {
    /** Spaces to ingest; when empty every visible space is discovered. */
    @Singular
    List<String> spaceKeys;
    /** Only pages modified within this many days; null for all time. */
    Integer lookbackDays;
    @Builder.Default
    int pageLimit = 25;
    @Builder.Default
    boolean includeComments = true;

    public ConfluenceConfig validate() {
        if (pageLimit <= 0) {
            throw new ConfigurationException("Confluence pageLimit must be positive, was " + pageLimit);
        }
        if (lookbackDays != null && lookbackDays <= 0) {
            throw new ConfigurationException("Confluence lookbackDays must be positive, was " + lookbackDays);
        }
        return this;
    }
}

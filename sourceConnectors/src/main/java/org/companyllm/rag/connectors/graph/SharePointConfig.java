package org.companyllm.rag.connectors.graph;

import java.time.Clock;
import java.util.List;
import java.util.Set;

import org.companyllm.rag.pipeline.error.ConfigurationException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class SharePointConfig {
    public static final Set<String> DEFAULT_TEXT_MIME_TYPES = Set.of(
        "text/plain", "text/markdown", "text/csv", "text/html", "application/json", "application/xml", "text/xml");

    /** Sites to ingest by name; when empty every site visible to the application is discovered. */
    @Singular
    List<String> siteNames;
    /** Only files modified within this many days; null for all time. */
    Integer lookbackDays;
    /** Files of these types are downloaded as text; others get a placeholder body. */
    @Builder.Default
    Set<String> textMimeTypes = DEFAULT_TEXT_MIME_TYPES;
    @Builder.Default
    Clock clock = Clock.systemUTC();

    public SharePointConfig validate() {
        if (lookbackDays != null && lookbackDays <= 0) {
            throw new ConfigurationException("SharePoint lookbackDays must be positive, was " + lookbackDays);
        }
        return this;
    }
}

package org.companyllm.rag.connectors.jira;

import java.util.List;

import org.companyllm.rag.pipeline.error.ConfigurationException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class JiraConfig {
    /** Projects to ingest; when empty every project visible to the account is discovered. */
    @Singular
    List<String> projectKeys;
    /** Only issues updated within this many days; null for all time. */
    Integer lookbackDays;
    @Builder.Default
    int maxResults = 50;

    public JiraConfig validate() {
        if (maxResults <= 0) {
            throw new ConfigurationException("Jira maxResults must be positive, was " + maxResults);
        }
        if (lookbackDays != null && lookbackDays <= 0) {
            throw new ConfigurationException("Jira lookbackDays must be positive, was " + lookbackDays);
        }
        return this;
    }
}

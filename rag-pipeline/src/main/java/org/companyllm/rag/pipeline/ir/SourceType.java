package org.companyllm.rag.pipeline.ir;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The collaboration systems records are ingested from.
 */
public enum SourceType {
    JIRA("jira"),
    CONFLUENCE("confluence"),
    SHAREPOINT("sharepoint"),
    TEAMS("teams");

    private final String wireName;

    SourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SourceType fromWireName(String name) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown source type: " + name));
    }
}

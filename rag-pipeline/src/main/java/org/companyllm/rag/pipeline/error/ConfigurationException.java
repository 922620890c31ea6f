package org.companyllm.rag.pipeline.error;

import java.util.List;

/**
 * Invalid or missing settings. Always fatal at startup.
 */
public class ConfigurationException extends RagPipelineException {
    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(List<String> problems) {
        super("Configuration errors:\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}

package org.companyllm.rag.pipeline.ir;

import java.util.List;

public record RunReport(IngestionSummary summary, List<SourceReport> sources) {
    public RunReport {
        sources = List.copyOf(sources);
    }

    public boolean allSourcesCompleted() {
        return sources.stream().allMatch(SourceReport::completed);
    }
}

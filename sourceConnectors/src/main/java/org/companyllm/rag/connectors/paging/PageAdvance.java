package org.companyllm.rag.connectors.paging;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Records found on a page and the request for the following page, absent on the last page.
 */
public record PageAdvance(List<JsonNode> records, Optional<PageRequest> next) {
    public PageAdvance {
        records = List.copyOf(records);
    }

    public static PageAdvance last(List<JsonNode> records) {
        return new PageAdvance(records, Optional.empty());
    }
}

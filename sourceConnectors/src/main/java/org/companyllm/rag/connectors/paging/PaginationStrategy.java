package org.companyllm.rag.connectors.paging;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * How a provider's listing advances from page to page. Chosen when a source is
 * constructed; the {@link Paginator} only ever talks to this interface.
 */
public interface PaginationStrategy {

    PageRequest firstRequest();

    /**
     * Extract the page's records and decide whether another page follows.
     */
    PageAdvance advance(PageRequest request, JsonNode response);

    /** Records array at {@code field}; a missing or non-array field means an empty page. */
    static List<JsonNode> recordsAt(JsonNode response, String field) {
        var node = response.path(field);
        if (!node.isArray()) {
            return List.of();
        }
        var records = new ArrayList<JsonNode>(node.size());
        node.forEach(records::add);
        return records;
    }
}

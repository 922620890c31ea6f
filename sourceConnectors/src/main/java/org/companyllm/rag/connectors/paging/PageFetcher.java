package org.companyllm.rag.connectors.paging;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Fetches one page of a paginated listing.
 */
@FunctionalInterface
public interface PageFetcher {
    /**
     * @param pathOrUrl a path under the provider's base URI, or an absolute next-page link
     */
    Mono<JsonNode> fetchJson(String pathOrUrl);
}

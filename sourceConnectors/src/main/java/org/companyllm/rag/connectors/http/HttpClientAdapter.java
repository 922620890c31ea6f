package org.companyllm.rag.connectors.http;

import java.net.URI;
import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Abstraction over the HTTP client so {@link RestClient} can be exercised without a network stack.
 */
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method  the HTTP method (GET, POST)
     * @param uri     the absolute request URI
     * @param body    the request body, or null if none
     * @param headers the request headers
     * @return a Mono that emits the response, whatever its status
     */
    Mono<HttpResponse> request(String method, URI uri, String body, Map<String, List<String>> headers);
}

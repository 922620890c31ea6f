package org.companyllm.rag.connectors.http;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.companyllm.rag.connectors.paging.PageFetcher;
import org.companyllm.rag.pipeline.error.TransportException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * JSON-over-HTTP client for one provider API.
 *
 * Every failure to obtain a successful response (non-2xx status, IO error,
 * timeout, unparseable body) surfaces as a {@link TransportException}.
 */
@Slf4j
public class RestClient implements PageFetcher {
    private static final String USER_AGENT_HEADER_NAME = "User-Agent";
    private static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";
    private static final String ACCEPT_HEADER_NAME = "Accept";
    private static final String AUTHORIZATION_HEADER_NAME = "Authorization";

    private static final String USER_AGENT = "CompanyLlmRag-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final int MAX_ERROR_BODY_CHARS = 500;

    @Getter
    private final ConnectionContext connectionContext;
    private final HttpClientAdapter httpClientAdapter;
    private final ObjectMapper objectMapper;

    public RestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this(connectionContext, httpClientAdapter, new ObjectMapper());
    }

    public RestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter, ObjectMapper objectMapper) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
        this.objectMapper = objectMapper;
    }

    public static RestClient create(ConnectionContext connectionContext) {
        return new RestClient(connectionContext, ReactorNettyAdapter.create(connectionContext));
    }

    /**
     * Performs a request and requires a 2xx response.
     */
    public Mono<HttpResponse> asyncRequest(String method, String pathOrUrl, String body, Map<String, List<String>> additionalHeaders) {
        return Mono.defer(() -> {
            var uri = connectionContext.resolve(pathOrUrl);
            log.atDebug().setMessage("{} {}").addArgument(method).addArgument(uri).log();
            return httpClientAdapter.request(method, uri, body, prepareHeaders(body, additionalHeaders))
                .timeout(connectionContext.getRequestTimeout())
                .onErrorMap(e -> !(e instanceof TransportException), e -> toTransportException(method, uri, e))
                .flatMap(response -> requireSuccess(method, uri, response));
        });
    }

    protected Map<String, List<String>> prepareHeaders(String body, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(ACCEPT_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        connectionContext.getAuth().authorizationHeader()
            .ifPresent(value -> headers.put(AUTHORIZATION_HEADER_NAME, List.of(value)));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        return headers;
    }

    public Mono<JsonNode> getJson(String pathOrUrl) {
        return asyncRequest("GET", pathOrUrl, null, null).map(response -> parse(pathOrUrl, response));
    }

    /** Raw body of a GET; used for file downloads. */
    public Mono<String> getText(String pathOrUrl) {
        return asyncRequest("GET", pathOrUrl, null, Map.of(ACCEPT_HEADER_NAME, List.of("*/*")))
            .map(response -> response.body() == null ? "" : response.body());
    }

    public Mono<JsonNode> postJson(String pathOrUrl, JsonNode body) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(serialized -> asyncRequest("POST", pathOrUrl, serialized, null))
            .map(response -> parse(pathOrUrl, response));
    }

    @Override
    public Mono<JsonNode> fetchJson(String pathOrUrl) {
        return getJson(pathOrUrl);
    }

    private JsonNode parse(String pathOrUrl, HttpResponse response) {
        try {
            var body = response.body();
            return body == null || body.isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException("Response from " + pathOrUrl + " is not valid JSON", response.statusCode(), e);
        }
    }

    private static Mono<HttpResponse> requireSuccess(String method, URI uri, HttpResponse response) {
        if (response.isSuccess()) {
            return Mono.just(response);
        }
        var body = response.body() == null ? "" : response.body();
        if (body.length() > MAX_ERROR_BODY_CHARS) {
            body = body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
        }
        return Mono.error(new TransportException(
            method + " " + uri + " failed with " + response.statusCode() + " " + response.statusText() + ": " + body,
            response.statusCode(),
            null));
    }

    private static TransportException toTransportException(String method, URI uri, Throwable e) {
        if (e instanceof TimeoutException) {
            return new TransportException(method + " " + uri + " timed out", e);
        }
        if (e instanceof IOException) {
            return new TransportException(method + " " + uri + " failed: " + e.getMessage(), e);
        }
        return new TransportException(method + " " + uri + " failed unexpectedly: " + e, e);
    }
}

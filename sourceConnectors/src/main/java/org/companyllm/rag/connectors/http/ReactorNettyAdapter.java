package org.companyllm.rag.connectors.http;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.net.ssl.SSLException;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Implementation of HttpClientAdapter using Reactor Netty.
 */
public class ReactorNettyAdapter implements HttpClientAdapter {
    private final HttpClient client;

    public ReactorNettyAdapter(HttpClient client) {
        this.client = client;
    }

    /** Client configured for {@code connectionContext}: response timeout, redirects, optional insecure TLS. */
    public static ReactorNettyAdapter create(ConnectionContext connectionContext) {
        var client = HttpClient.create()
            .responseTimeout(connectionContext.getRequestTimeout())
            .followRedirect(true)
            .keepAlive(true);
        if (connectionContext.isInsecure()) {
            client = client.secure(spec -> spec.sslContext(insecureSslContext()));
        }
        return new ReactorNettyAdapter(client);
    }

    private static SslContext insecureSslContext() {
        try {
            return SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct insecure SslContext", e);
        }
    }

    @Override
    public Mono<HttpResponse> request(String method, URI uri, String body, Map<String, List<String>> headers) {
        return client
            .headers(h -> headers.forEach(h::add))
            .request(HttpMethod.valueOf(method))
            .uri(uri)
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle((response, bytes) -> bytes.asString(StandardCharsets.UTF_8)
                .singleOptional()
                .map(bodyOp -> new HttpResponse(
                    response.status().code(),
                    response.status().reasonPhrase(),
                    extractHeaders(response.responseHeaders()),
                    bodyOp.orElse(null)
                )));
    }

    private static Map<String, String> extractHeaders(io.netty.handler.codec.http.HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }
}

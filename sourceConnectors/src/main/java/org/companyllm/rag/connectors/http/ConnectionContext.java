package org.companyllm.rag.connectors.http;

import java.net.URI;
import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Where and how to reach one provider API.
 */
@Value
@Builder
public class ConnectionContext {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    URI baseUri;
    @Builder.Default
    AuthConfig auth = AuthConfig.NoAuth.INSTANCE;
    @Builder.Default
    Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    /** Skip TLS certificate and hostname verification. */
    boolean insecure;

    public static ConnectionContext of(String baseUri, AuthConfig auth) {
        return builder().baseUri(URI.create(baseUri)).auth(auth).build();
    }

    /**
     * Absolute URLs (such as pagination links and download URLs) are used as-is;
     * anything else is treated as a path under {@link #getBaseUri()}.
     */
    public URI resolve(String pathOrUrl) {
        if (pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")) {
            return URI.create(pathOrUrl);
        }
        var base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (pathOrUrl.startsWith("/") ? pathOrUrl : "/" + pathOrUrl));
    }
}

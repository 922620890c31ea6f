package org.companyllm.rag.connectors.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered, URL-encoded query parameters.
 */
public class QueryString {
    private final Map<String, String> params = new LinkedHashMap<>();

    public static QueryString of(String name, Object value) {
        return new QueryString().and(name, value);
    }

    public QueryString and(String name, Object value) {
        if (value != null) {
            params.put(name, value.toString());
        }
        return this;
    }

    public QueryString copy() {
        var copy = new QueryString();
        copy.params.putAll(params);
        return copy;
    }

    public String appendTo(String path) {
        if (params.isEmpty()) {
            return path;
        }
        return path + (path.contains("?") ? "&" : "?") + toString();
    }

    @Override
    public String toString() {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

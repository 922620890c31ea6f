package org.companyllm.rag.connectors.http;

import java.util.Map;

public record HttpResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}

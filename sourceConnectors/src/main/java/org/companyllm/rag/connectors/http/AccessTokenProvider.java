package org.companyllm.rag.connectors.http;

/**
 * Supplies bearer tokens. Token acquisition flows live outside this project; an
 * implementation may cache and refresh as it sees fit.
 */
@FunctionalInterface
public interface AccessTokenProvider {
    String accessToken();
}

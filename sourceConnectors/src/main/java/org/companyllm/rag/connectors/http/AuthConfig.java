package org.companyllm.rag.connectors.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

public interface AuthConfig {

    /** Value for the Authorization header, if this scheme sends one. */
    Optional<String> authorizationHeader();

    class NoAuth implements AuthConfig {
        public static final NoAuth INSTANCE = new NoAuth();
        private NoAuth() {}

        @Override
        public Optional<String> authorizationHeader() {
            return Optional.empty();
        }
    }

    /** Atlassian Cloud style: account email and API token. */
    class BasicAuth implements AuthConfig {
        public final String username;
        public final String password;

        public BasicAuth(String username, String password) {
            if (username == null || password == null) {
                throw new IllegalArgumentException("Both username and password must be provided");
            }
            this.username = username;
            this.password = password;
        }

        @Override
        public Optional<String> authorizationHeader() {
            var credentials = username + ":" + password;
            return Optional.of("Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
    }

    class BearerAuth implements AuthConfig {
        public final AccessTokenProvider tokenProvider;

        public BearerAuth(AccessTokenProvider tokenProvider) {
            if (tokenProvider == null) {
                throw new IllegalArgumentException("A token provider must be provided");
            }
            this.tokenProvider = tokenProvider;
        }

        public static BearerAuth ofToken(String token) {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("Token must not be blank");
            }
            return new BearerAuth(() -> token);
        }

        @Override
        public Optional<String> authorizationHeader() {
            return Optional.of("Bearer " + tokenProvider.accessToken());
        }
    }
}

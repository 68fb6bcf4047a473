package io.tokenkeeper.sdk.credentials;

import java.util.Objects;

/**
 * OAuth client identity, sent to the token provider with HTTP Basic authentication.
 */
public record ClientCredentials(String id, String secret) {

    public ClientCredentials {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(secret, "secret");
    }

    @Override
    public String toString() {
        return "ClientCredentials[id=" + id + ", secret=***]";
    }
}

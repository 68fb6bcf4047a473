package io.tokenkeeper.sdk.credentials;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of the credential material loaded at one point in time.
 *
 * @param client    client credentials, always present
 * @param user      resource-owner credentials, {@code null} when only the client credentials grant is used
 * @param loadedAt  when the material was read
 */
public record CredentialsSnapshot(ClientCredentials client, UserCredentials user, Instant loadedAt) {

    public CredentialsSnapshot {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(loadedAt, "loadedAt");
    }

    public Optional<UserCredentials> userCredentials() {
        return Optional.ofNullable(user);
    }
}

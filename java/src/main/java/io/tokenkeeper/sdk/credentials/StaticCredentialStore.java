package io.tokenkeeper.sdk.credentials;

import java.time.Instant;

/**
 * Uses fixed credentials. Useful for tests and for credentials injected by a secret manager.
 */
public final class StaticCredentialStore implements CredentialStore {

    private final CredentialsSnapshot snapshot;

    public StaticCredentialStore(ClientCredentials client, UserCredentials user) {
        this.snapshot = new CredentialsSnapshot(client, user, Instant.now());
    }

    public StaticCredentialStore(String clientId, String clientSecret) {
        this(new ClientCredentials(clientId, clientSecret), null);
    }

    @Override
    public CredentialsSnapshot load() {
        return snapshot;
    }

    @Override
    public CredentialsSnapshot current() {
        return snapshot;
    }

    @Override
    public CredentialsSnapshot reload() {
        return snapshot;
    }
}

package io.tokenkeeper.sdk.credentials;

/**
 * Source of credential material shared read-only by every token slot.
 */
public interface CredentialStore {

    /**
     * Reads the credential material and installs it as the current snapshot.
     */
    CredentialsSnapshot load() throws CredentialException;

    /**
     * @return the latest loaded snapshot, without I/O.
     * @throws IllegalStateException when nothing has been loaded yet.
     */
    CredentialsSnapshot current();

    /**
     * Re-reads the credential material. On failure the previous snapshot stays in effect and the error is thrown.
     */
    CredentialsSnapshot reload() throws CredentialException;
}

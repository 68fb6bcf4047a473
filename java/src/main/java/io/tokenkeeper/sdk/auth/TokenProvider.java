package io.tokenkeeper.sdk.auth;

import io.tokenkeeper.sdk.credentials.CredentialsSnapshot;

import java.util.Set;

/**
 * Contract for exchanging credentials for an access token.
 */
@FunctionalInterface
public interface TokenProvider {

    AccessToken acquire(CredentialsSnapshot credentials, Set<String> scopes) throws ProviderException;
}

package io.tokenkeeper.sdk.resource;

import io.tokenkeeper.sdk.TokenKeeperException;

import java.util.Set;

/**
 * Thrown when an authenticated caller lacks a required scope.
 */
public final class NotAuthorizedException extends TokenKeeperException {

    private static final long serialVersionUID = 1L;

    private final String subject;
    private final Set<String> missingScopes;

    public NotAuthorizedException(String subject, Set<String> missingScopes) {
        super("subject " + subject + " is missing scopes " + missingScopes);
        this.subject = subject;
        this.missingScopes = Set.copyOf(missingScopes);
    }

    public String getSubject() {
        return subject;
    }

    public Set<String> getMissingScopes() {
        return missingScopes;
    }
}

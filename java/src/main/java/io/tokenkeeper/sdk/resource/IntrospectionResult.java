package io.tokenkeeper.sdk.resource;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * What the token-info service said about a bearer token.
 */
public final class IntrospectionResult {

    private final boolean active;
    private final String subject;
    private final Set<String> scopes;
    private final Instant expiresAt;
    private final String realm;
    private final Map<String, Object> rawClaims;
    private final Instant fetchedAt;

    public IntrospectionResult(
        boolean active,
        String subject,
        Set<String> scopes,
        Instant expiresAt,
        String realm,
        Map<String, Object> rawClaims,
        Instant fetchedAt
    ) {
        this.active = active;
        this.subject = subject;
        this.scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        this.expiresAt = expiresAt;
        this.realm = realm;
        this.rawClaims = rawClaims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawClaims));
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt");
    }

    public boolean isActive() {
        return active;
    }

    public String getSubject() {
        return subject;
    }

    public Set<String> getScopes() {
        return scopes;
    }

    /**
     * @return when the token expires, or null when the service did not say.
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public String getRealm() {
        return realm;
    }

    /**
     * @return every field of the token-info response, as decoded JSON.
     */
    public Map<String, Object> getRawClaims() {
        return rawClaims;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    public boolean hasScopes(Collection<String> required) {
        return scopes.containsAll(required);
    }

    /**
     * @throws NotAuthorizedException listing the required scopes the token does not carry.
     */
    public void authorize(String... required) throws NotAuthorizedException {
        Set<String> missing = new LinkedHashSet<>(Arrays.asList(required));
        missing.removeAll(scopes);
        if (!missing.isEmpty()) {
            throw new NotAuthorizedException(subject, missing);
        }
    }

    @Override
    public String toString() {
        return "IntrospectionResult[subject=" + subject + ", realm=" + realm + ", scopes=" + scopes
            + ", expiresAt=" + expiresAt + "]";
    }
}

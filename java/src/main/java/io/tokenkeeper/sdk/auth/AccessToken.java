package io.tokenkeeper.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Represents an issued access token and its lifetime. Instances are immutable and safe to share.
 */
public final class AccessToken {

    private final String value;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final Set<String> scopes;

    public AccessToken(String value, Instant issuedAt, Instant expiresAt, Set<String> scopes) {
        this.value = Objects.requireNonNull(value, "value");
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
        this.scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public String getValue() {
        return value;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Set<String> getScopes() {
        return scopes;
    }

    public Duration getLifetime() {
        return Duration.between(issuedAt, expiresAt);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * @return {@code issuedAt + factor * lifetime}, truncated to milliseconds.
     */
    public Instant instantAt(double factor) {
        long millis = (long) (getLifetime().toMillis() * factor);
        return issuedAt.plusMillis(millis);
    }

    @Override
    public String toString() {
        return "AccessToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + ", scopes=" + scopes + "]";
    }
}

package io.tokenkeeper.sdk.resource;

import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for bearer tokens carried in HTTP requests.
 */
public final class BearerTokens {

    private static final String BEARER = "bearer";

    private BearerTokens() {
    }

    /**
     * Extracts the token from an {@code Authorization} header value such as {@code "Bearer abc"}. The scheme is
     * matched case-insensitively.
     *
     * @return the token, or empty when the header is absent, uses another scheme, or carries no token.
     */
    public static Optional<String> fromAuthorizationHeader(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        int space = trimmed.indexOf(' ');
        if (space <= 0) {
            return Optional.empty();
        }
        String scheme = trimmed.substring(0, space);
        if (!BEARER.equals(scheme.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String token = trimmed.substring(space + 1).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}

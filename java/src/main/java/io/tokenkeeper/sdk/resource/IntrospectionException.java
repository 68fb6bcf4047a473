package io.tokenkeeper.sdk.resource;

import io.tokenkeeper.sdk.TokenKeeperException;

/**
 * Raised when a bearer token cannot be introspected.
 */
public final class IntrospectionException extends TokenKeeperException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** No token-info endpoint could be reached; the token may still be valid. */
        UNAVAILABLE,
        /** The token-info service says the token is not valid. */
        INVALID,
        /** Every endpoint answered, but with an unusable body. */
        RESPONSE_MALFORMED
    }

    private final Kind kind;
    private final int statusCode;

    public IntrospectionException(Kind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    public IntrospectionException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the HTTP status that decided the outcome, or 0 when there was none.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

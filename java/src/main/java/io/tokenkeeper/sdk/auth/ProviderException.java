package io.tokenkeeper.sdk.auth;

import io.tokenkeeper.sdk.TokenKeeperException;

/**
 * Raised when the token provider cannot issue an access token.
 */
public final class ProviderException extends TokenKeeperException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Every configured provider endpoint failed. */
        UNAVAILABLE,
        /** A provider answered authoritatively with a client error; not retried. */
        REJECTED,
        /** Every provider endpoint answered with an unusable body. */
        RESPONSE_MALFORMED
    }

    private final Kind kind;
    private final int statusCode;
    private final String errorCode;

    public ProviderException(Kind kind, String message, Throwable cause) {
        this(kind, 0, null, message, cause);
    }

    public ProviderException(Kind kind, int statusCode, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return HTTP status of a rejection, {@code 0} when not applicable.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return OAuth {@code error} code of a rejection (nullable).
     */
    public String getErrorCode() {
        return errorCode;
    }
}

package io.tokenkeeper.sdk.jwt;

import io.tokenkeeper.sdk.TokenKeeperException;

/**
 * Raised when a JWT fails local validation.
 */
public final class JwtValidationException extends TokenKeeperException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        SIGNATURE_INVALID,
        EXPIRED,
        MALFORMED,
        CLAIMS_MISSING,
        CLAIM_MISMATCH
    }

    private final Kind kind;

    public JwtValidationException(Kind kind, String message) {
        this(kind, message, null);
    }

    public JwtValidationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

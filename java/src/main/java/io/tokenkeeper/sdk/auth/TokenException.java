package io.tokenkeeper.sdk.auth;

import io.tokenkeeper.sdk.TokenKeeperException;

/**
 * Raised by {@link TokenLifecycleManager#getToken(String)} when no valid token can be served.
 */
public final class TokenException extends TokenKeeperException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** No token has been acquired yet, or acquisition keeps failing. */
        UNAVAILABLE,
        /** The slot's token expired and could not be replaced. */
        EXPIRED,
        /** No slot is registered under the requested name. */
        UNKNOWN_SLOT
    }

    private final Kind kind;
    private final String slot;

    public TokenException(Kind kind, String slot, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.slot = slot;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSlot() {
        return slot;
    }
}

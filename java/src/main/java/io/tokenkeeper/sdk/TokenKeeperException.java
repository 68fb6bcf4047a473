package io.tokenkeeper.sdk;

/**
 * Base exception thrown by the tokenkeeper SDK.
 */
public class TokenKeeperException extends Exception {

    private static final long serialVersionUID = 1L;

    public TokenKeeperException(String message) {
        super(message);
    }

    public TokenKeeperException(String message, Throwable cause) {
        super(message, cause);
    }
}

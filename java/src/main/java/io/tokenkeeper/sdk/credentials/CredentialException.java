package io.tokenkeeper.sdk.credentials;

import io.tokenkeeper.sdk.TokenKeeperException;

import java.nio.file.Path;

/**
 * Raised when credential material cannot be loaded.
 */
public final class CredentialException extends TokenKeeperException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NOT_FOUND,
        MALFORMED
    }

    private final Kind kind;
    private final transient Path path;

    public CredentialException(Kind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the offending file (nullable for non file based stores).
     */
    public Path getPath() {
        return path;
    }
}

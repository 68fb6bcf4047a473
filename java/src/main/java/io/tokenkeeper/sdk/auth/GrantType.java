package io.tokenkeeper.sdk.auth;

/**
 * OAuth grants supported when requesting tokens.
 */
public enum GrantType {
    CLIENT_CREDENTIALS("client_credentials"),
    PASSWORD("password");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}

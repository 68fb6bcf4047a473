package io.tokenkeeper.sdk.credentials;

import java.util.Objects;

/**
 * Resource-owner credentials used with the {@code password} grant.
 */
public record UserCredentials(String username, String password) {

    public UserCredentials {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    @Override
    public String toString() {
        return "UserCredentials[username=" + username + ", password=***]";
    }
}

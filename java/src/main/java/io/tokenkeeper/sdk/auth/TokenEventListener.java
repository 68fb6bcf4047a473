package io.tokenkeeper.sdk.auth;

/**
 * Observer of token lifecycle events. Called from refresh threads and from reader threads; implementations must be
 * thread-safe and should return quickly.
 */
@FunctionalInterface
public interface TokenEventListener {

    void onEvent(TokenEvent event);
}

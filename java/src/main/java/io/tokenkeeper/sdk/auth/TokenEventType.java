package io.tokenkeeper.sdk.auth;

/**
 * Lifecycle events emitted by the {@link TokenLifecycleManager}.
 */
public enum TokenEventType {
    ACQUIRED,
    REFRESHED,
    WARNING,
    EXPIRED,
    PROVIDER_UNAVAILABLE
}

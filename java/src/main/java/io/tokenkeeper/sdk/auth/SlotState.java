package io.tokenkeeper.sdk.auth;

/**
 * Lifecycle state of a token slot.
 */
public enum SlotState {
    /** No token, either never acquired or the last acquisition failed. */
    EMPTY,
    /** First acquisition (or re-acquisition after expiry) in flight. */
    ACQUIRING,
    /** Token is served and its refresh is not yet due or succeeded. */
    VALID,
    /** Refresh in flight while the current token keeps being served. */
    REFRESHING,
    /** Refresh failed past the warning threshold; the token is still served. */
    WARNING,
    /** The token expired without a successful refresh. */
    EXPIRED;

    /**
     * @return whether readers are served the cached token in this state.
     */
    public boolean servesToken() {
        return this == VALID || this == REFRESHING || this == WARNING;
    }
}

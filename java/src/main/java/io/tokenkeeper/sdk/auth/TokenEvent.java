package io.tokenkeeper.sdk.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Structured lifecycle event for one slot. Never carries the token value.
 *
 * @param type      what happened
 * @param slot      slot name
 * @param at        when it happened
 * @param expiresAt expiry of the slot's token at that moment (nullable)
 * @param error     the provider failure for {@link TokenEventType#PROVIDER_UNAVAILABLE} (nullable)
 */
public record TokenEvent(TokenEventType type, String slot, Instant at, Instant expiresAt, Throwable error) {

    public TokenEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(at, "at");
    }
}

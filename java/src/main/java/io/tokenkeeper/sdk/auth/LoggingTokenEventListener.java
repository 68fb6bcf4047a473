package io.tokenkeeper.sdk.auth;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default listener writing lifecycle events to {@code java.util.logging}.
 */
public final class LoggingTokenEventListener implements TokenEventListener {

    private static final Logger LOGGER = Logger.getLogger(LoggingTokenEventListener.class.getName());

    @Override
    public void onEvent(TokenEvent event) {
        switch (event.type()) {
            case ACQUIRED, REFRESHED -> LOGGER.info(() -> String.format(Locale.ROOT,
                "[tokenkeeper] token '%s' %s, valid until %s",
                event.slot(), event.type().name().toLowerCase(Locale.ROOT), event.expiresAt()));
            case WARNING -> LOGGER.warning(() -> String.format(Locale.ROOT,
                "[tokenkeeper] token '%s' becomes too old, refresh keeps failing (valid until %s)",
                event.slot(), event.expiresAt()));
            case EXPIRED -> LOGGER.severe(() -> String.format(Locale.ROOT,
                "[tokenkeeper] token '%s' expired at %s without a successful refresh",
                event.slot(), event.expiresAt()));
            case PROVIDER_UNAVAILABLE -> LOGGER.log(Level.WARNING, event.error(), () -> String.format(Locale.ROOT,
                "[tokenkeeper] could not update token '%s' (current token valid until %s)",
                event.slot(), event.expiresAt()));
            default -> throw new IllegalStateException("unexpected event type " + event.type());
        }
    }
}

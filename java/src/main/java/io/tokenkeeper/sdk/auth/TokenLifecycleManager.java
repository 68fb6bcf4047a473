package io.tokenkeeper.sdk.auth;

import io.tokenkeeper.sdk.Config;
import io.tokenkeeper.sdk.credentials.CredentialStore;
import io.tokenkeeper.sdk.credentials.CredentialsSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a set of named access tokens fresh in the background.
 *
 * <p>
 * Each slot is refreshed once {@code refreshFactor} of its token lifetime has elapsed. Failed attempts are retried
 * with capped exponential backoff while the current token keeps being served. A {@link TokenEventType#WARNING} event is
 * emitted once {@code warningFactor} of the lifetime has elapsed without a successful refresh, and
 * {@link TokenEventType#EXPIRED} when the token finally runs out.
 * </p>
 *
 * <p>
 * Readers of a valid token never block. Refresh attempts for one slot are serialized; slots are independent.
 * </p>
 */
public final class TokenLifecycleManager implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TokenLifecycleManager.class.getName());

    private final CredentialStore credentials;
    private final TokenProvider provider;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;
    private final double refreshFactor;
    private final double warningFactor;
    private final Backoff backoff;
    private final TokenEventListener listener;
    private final ConcurrentMap<String, TokenSlot> slots = new ConcurrentHashMap<>();

    private volatile boolean closed;

    private TokenLifecycleManager(Builder builder) {
        this.credentials = Objects.requireNonNull(builder.credentials, "credentials");
        this.provider = Objects.requireNonNull(builder.provider, "provider");
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? new ExecutorTaskScheduler() : builder.scheduler;
        this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        this.refreshFactor = builder.refreshFactor;
        this.warningFactor = builder.warningFactor;
        this.backoff = new Backoff(
            builder.retryInitialDelay == null ? Config.DEFAULT_RETRY_INITIAL_DELAY : builder.retryInitialDelay,
            builder.retryMaxDelay == null ? Config.DEFAULT_RETRY_MAX_DELAY : builder.retryMaxDelay
        );
        this.listener = builder.listener == null ? new LoggingTokenEventListener() : builder.listener;
    }

    public static Builder builder(CredentialStore credentials, TokenProvider provider) {
        return new Builder(credentials, provider);
    }

    /**
     * Creates a manager talking to the token provider endpoints of {@code config}, with its own scheduler.
     */
    public static TokenLifecycleManager create(Config config, CredentialStore credentials) {
        Objects.requireNonNull(config, "config");
        Clock clock = Clock.systemUTC();
        return builder(credentials, new HttpTokenProvider(config, clock))
            .clock(clock)
            .refreshFactor(config.getRefreshFactor())
            .warningFactor(config.getWarningFactor())
            .retryInitialDelay(config.getRetryInitialDelay())
            .retryMaxDelay(config.getRetryMaxDelay())
            .build();
    }

    /**
     * Registers a token slot and starts acquiring its token in the background. Registering an existing name again
     * has no effect; the first registration's scopes are kept.
     *
     * @return true when a new slot was created.
     */
    public boolean registerSlot(String name, Set<String> scopes) {
        Objects.requireNonNull(name, "name");
        if (closed) {
            throw new IllegalStateException("token manager is shut down");
        }
        boolean[] created = new boolean[1];
        TokenSlot slot = slots.computeIfAbsent(name, key -> {
            created[0] = true;
            return new TokenSlot(key, scopes, clock.instant());
        });
        if (!created[0]) {
            LOGGER.fine(() -> "[tokenkeeper] token slot '" + name + "' already registered");
            return false;
        }
        LOGGER.info(() -> String.format(Locale.ROOT, "[tokenkeeper] registered token slot '%s' with scopes %s",
            name, slot.scopes()));
        scheduleIn(slot, Duration.ZERO);
        return true;
    }

    /**
     * Returns the current token of a slot.
     *
     * <p>
     * A valid token is returned immediately. When the slot holds no token and a retry is due, one acquisition attempt
     * is made on the calling thread (or the caller waits for the attempt already in flight).
     * </p>
     *
     * @throws TokenException {@code UNKNOWN_SLOT} for an unregistered name, {@code EXPIRED} when the token ran out,
     *                        {@code UNAVAILABLE} when no token could be acquired yet.
     */
    public AccessToken getToken(String name) throws TokenException {
        TokenSlot slot = slots.get(name);
        if (slot == null) {
            throw new TokenException(TokenException.Kind.UNKNOWN_SLOT, name, "no token slot named '" + name + "'", null);
        }

        Instant now = clock.instant();
        AccessToken current = slot.token();
        if (current != null) {
            if (!current.isExpired(now)) {
                return current;
            }
            expire(slot, current, now);
            throw new TokenException(TokenException.Kind.EXPIRED, name,
                "token '" + name + "' expired at " + current.getExpiresAt(), slot.lastError());
        }

        if (!closed && slot.isRetryDue(now)) {
            AccessToken acquired = acquireOnCaller(slot);
            if (acquired != null) {
                return acquired;
            }
        }
        throw unavailable(slot);
    }

    public SlotState state(String name) {
        TokenSlot slot = slots.get(name);
        if (slot == null) {
            throw new IllegalArgumentException("no token slot named '" + name + "'");
        }
        return slot.state();
    }

    public List<String> slotNames() {
        return List.copyOf(slots.keySet());
    }

    public boolean isShutdown() {
        return closed;
    }

    /**
     * Stops every background task. Valid cached tokens are still served afterwards, but none is acquired anymore.
     */
    public void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        for (TokenSlot slot : slots.values()) {
            slot.cancelPending();
        }
        if (ownsScheduler) {
            scheduler.close();
        }
        LOGGER.info(() -> "[tokenkeeper] token manager shut down, " + slots.size() + " slot(s) stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private AccessToken acquireOnCaller(TokenSlot slot) {
        AccessToken result = null;
        boolean attempted = false;
        slot.refreshLock().lock();
        try {
            Instant now = clock.instant();
            AccessToken current = slot.token();
            if (current != null && !current.isExpired(now)) {
                return current;
            }
            if (current != null) {
                expire(slot, current, now);
            }
            if (!closed && slot.isRetryDue(now)) {
                attempted = true;
                result = attempt(slot);
            }
        } finally {
            slot.refreshLock().unlock();
        }
        if (attempted) {
            reschedule(slot);
        }
        return result;
    }

    private void runScheduled(TokenSlot slot) {
        if (closed) {
            return;
        }
        Instant now = clock.instant();
        AccessToken current = slot.token();
        if (current != null) {
            if (current.isExpired(now)) {
                expire(slot, current, now);
            } else if (!now.isBefore(current.instantAt(warningFactor)) && slot.markWarned()) {
                emit(TokenEventType.WARNING, slot, now, current.getExpiresAt(), slot.lastError());
            }
        }

        if (slot.isRetryDue(now)) {
            if (!slot.refreshLock().tryLock()) {
                // The thread holding the lock reschedules when it is done.
                return;
            }
            try {
                if (!closed && slot.isRetryDue(clock.instant())) {
                    attempt(slot);
                }
            } finally {
                slot.refreshLock().unlock();
            }
        }
        reschedule(slot);
    }

    /**
     * Performs one acquisition attempt. Must be called with the slot's refresh lock held.
     *
     * @return the installed token, or null when the attempt failed.
     */
    private AccessToken attempt(TokenSlot slot) {
        AccessToken previous = slot.token();
        slot.beginAttempt();
        Exception failure;
        try {
            CredentialsSnapshot snapshot = credentials.current();
            AccessToken fresh = provider.acquire(snapshot, slot.scopes());
            if (previous != null && fresh.getExpiresAt().isBefore(previous.getExpiresAt())) {
                failure = new ProviderException(ProviderException.Kind.RESPONSE_MALFORMED,
                    "refreshed token expires at " + fresh.getExpiresAt() + ", before the current token", null);
            } else {
                AccessToken replaced = slot.install(fresh, fresh.instantAt(refreshFactor));
                emit(replaced == null ? TokenEventType.ACQUIRED : TokenEventType.REFRESHED,
                    slot, clock.instant(), fresh.getExpiresAt(), null);
                return fresh;
            }
        } catch (ProviderException ex) {
            failure = ex;
        } catch (IllegalStateException ex) {
            // credentials not loaded
            failure = ex;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[tokenkeeper] token provider failed unexpectedly for slot "
                + slot.name());
            failure = new ProviderException(ProviderException.Kind.UNAVAILABLE,
                "token provider failed: " + ex.getClass().getSimpleName(), ex);
        }

        Instant now = clock.instant();
        slot.recordFailure(failure, now, backoff.delay(slot.failures() + 1));
        AccessToken current = slot.token();
        emit(TokenEventType.PROVIDER_UNAVAILABLE, slot, now, current == null ? null : current.getExpiresAt(), failure);
        return null;
    }

    private void expire(TokenSlot slot, AccessToken token, Instant now) {
        if (slot.dropExpired(token, now)) {
            emit(TokenEventType.EXPIRED, slot, now, token.getExpiresAt(), slot.lastError());
        }
    }

    private void reschedule(TokenSlot slot) {
        Instant now = clock.instant();
        Instant wake = slot.nextAttemptAt();
        AccessToken current = slot.token();
        if (current != null) {
            if (!slot.isWarned()) {
                wake = earliest(wake, current.instantAt(warningFactor));
            }
            wake = earliest(wake, current.getExpiresAt());
        }
        Duration delay = Duration.between(now, wake);
        scheduleIn(slot, delay.isNegative() ? Duration.ZERO : delay);
    }

    private void scheduleIn(TokenSlot slot, Duration delay) {
        synchronized (slot) {
            if (closed) {
                return;
            }
            slot.replacePending(scheduler.schedule(() -> runScheduled(slot), delay));
        }
    }

    private TokenException unavailable(TokenSlot slot) {
        String reason = closed ? ", token manager is shut down" : "";
        if (slot.hasExpired()) {
            return new TokenException(TokenException.Kind.EXPIRED, slot.name(),
                "token '" + slot.name() + "' expired and could not be renewed" + reason, slot.lastError());
        }
        return new TokenException(TokenException.Kind.UNAVAILABLE, slot.name(),
            "no token available for '" + slot.name() + "'" + reason, slot.lastError());
    }

    private void emit(TokenEventType type, TokenSlot slot, Instant at, Instant expiresAt, Throwable error) {
        TokenEvent event = new TokenEvent(type, slot.name(), at, expiresAt, error);
        try {
            listener.onEvent(event);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[tokenkeeper] token event listener failed on " + type
                + " for '" + slot.name() + "'");
        }
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    public static final class Builder {
        private final CredentialStore credentials;
        private final TokenProvider provider;
        private TaskScheduler scheduler;
        private Clock clock;
        private double refreshFactor = Config.DEFAULT_REFRESH_FACTOR;
        private double warningFactor = Config.DEFAULT_WARNING_FACTOR;
        private Duration retryInitialDelay;
        private Duration retryMaxDelay;
        private TokenEventListener listener;

        private Builder(CredentialStore credentials, TokenProvider provider) {
            this.credentials = credentials;
            this.provider = provider;
        }

        /**
         * Scheduler for background refreshes. When unset the manager creates and owns one.
         */
        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder refreshFactor(double refreshFactor) {
            this.refreshFactor = refreshFactor;
            return this;
        }

        public Builder warningFactor(double warningFactor) {
            this.warningFactor = warningFactor;
            return this;
        }

        public Builder retryInitialDelay(Duration retryInitialDelay) {
            this.retryInitialDelay = retryInitialDelay;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        public Builder listener(TokenEventListener listener) {
            this.listener = listener;
            return this;
        }

        public TokenLifecycleManager build() {
            if (!(refreshFactor > 0 && refreshFactor < warningFactor && warningFactor < 1)) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "factors must satisfy 0 < refreshFactor < warningFactor < 1, got %s and %s",
                    refreshFactor, warningFactor));
            }
            return new TokenLifecycleManager(this);
        }
    }
}

package io.tokenkeeper.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable lifecycle state of one named token, owned by {@link TokenLifecycleManager}.
 *
 * <p>
 * The token reference is read without locking. Bookkeeping fields are guarded by the slot's monitor and only touched
 * in short critical sections; the network call happens under {@link #refreshLock()} instead.
 * </p>
 */
final class TokenSlot {

    private final String name;
    private final Set<String> scopes;
    private final AtomicReference<AccessToken> token = new AtomicReference<>();
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile SlotState state = SlotState.EMPTY;
    private int failures;
    private Instant nextAttemptAt;
    private boolean warned;
    private boolean expired;
    private Exception lastError;
    private TaskScheduler.Cancellable pending;

    TokenSlot(String name, Set<String> scopes, Instant createdAt) {
        this.name = Objects.requireNonNull(name, "name");
        this.scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        this.nextAttemptAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    String name() {
        return name;
    }

    Set<String> scopes() {
        return scopes;
    }

    AccessToken token() {
        return token.get();
    }

    SlotState state() {
        return state;
    }

    ReentrantLock refreshLock() {
        return refreshLock;
    }

    /**
     * Drops {@code expiredToken} if it is still the current one.
     *
     * @return true for the single caller that performed the drop.
     */
    boolean dropExpired(AccessToken expiredToken, Instant now) {
        if (!token.compareAndSet(expiredToken, null)) {
            return false;
        }
        synchronized (this) {
            expired = true;
            warned = false;
            nextAttemptAt = now;
            state = SlotState.EXPIRED;
        }
        return true;
    }

    synchronized boolean isRetryDue(Instant now) {
        return !now.isBefore(nextAttemptAt);
    }

    synchronized Instant nextAttemptAt() {
        return nextAttemptAt;
    }

    synchronized boolean isWarned() {
        return warned;
    }

    synchronized boolean hasExpired() {
        return expired;
    }

    synchronized Exception lastError() {
        return lastError;
    }

    synchronized int failures() {
        return failures;
    }

    /**
     * @return true when this call crossed the warning threshold, false when it was already crossed.
     */
    synchronized boolean markWarned() {
        if (warned) {
            return false;
        }
        warned = true;
        state = SlotState.WARNING;
        return true;
    }

    synchronized void beginAttempt() {
        if (token.get() == null) {
            state = SlotState.ACQUIRING;
        } else if (state == SlotState.VALID) {
            state = SlotState.REFRESHING;
        }
    }

    /**
     * Installs a freshly issued token.
     *
     * @return the token it replaced, or null when the slot had none.
     */
    synchronized AccessToken install(AccessToken fresh, Instant refreshAt) {
        AccessToken replaced = token.getAndSet(fresh);
        failures = 0;
        warned = false;
        expired = false;
        lastError = null;
        nextAttemptAt = refreshAt;
        state = SlotState.VALID;
        return replaced;
    }

    synchronized void recordFailure(Exception error, Instant now, Duration retryIn) {
        failures++;
        lastError = error;
        nextAttemptAt = now.plus(retryIn);
        if (token.get() == null) {
            state = expired ? SlotState.EXPIRED : SlotState.EMPTY;
        } else {
            state = warned ? SlotState.WARNING : SlotState.VALID;
        }
    }

    synchronized void replacePending(TaskScheduler.Cancellable next) {
        if (pending != null) {
            pending.cancel();
        }
        pending = next;
    }

    synchronized void cancelPending() {
        replacePending(null);
    }

    @Override
    public String toString() {
        return "TokenSlot[name=" + name + ", state=" + state + ", scopes=" + scopes + "]";
    }
}

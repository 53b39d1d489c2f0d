package com.flagship.token_ledger.archive;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker for archive migrations.
 *
 * Attempts are allowed until {@code maxConsecutiveFailures} failures in a row.
 * The breaker then stays open for {@code cooldown}; after that one attempt is let
 * through (half-open). A success closes it again.
 * Not thread-safe; guarded by the ledger lock.
 */
public class MigrationRetryPolicy {

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int maxConsecutiveFailures;
    private final Duration cooldown;
    private int consecutiveFailures;
    private Instant openedAt;

    public MigrationRetryPolicy(int maxConsecutiveFailures, Duration cooldown) {
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be positive");
        }
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.cooldown = cooldown;
    }

    public boolean allowAttempt(Instant now) {
        return state(now) != State.OPEN;
    }

    public void recordSuccess() {
        consecutiveFailures = 0;
        openedAt = null;
    }

    public void recordFailure(Instant now) {
        consecutiveFailures++;
        if (consecutiveFailures >= maxConsecutiveFailures) {
            openedAt = now;
        }
    }

    public State state(Instant now) {
        if (openedAt == null) {
            return State.CLOSED;
        }
        return now.isBefore(openedAt.plus(cooldown)) ? State.OPEN : State.HALF_OPEN;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }
}

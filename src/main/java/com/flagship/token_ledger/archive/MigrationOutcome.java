package com.flagship.token_ledger.archive;

/**
 * Result of one post-commit migration check.
 */
public enum MigrationOutcome {
    /** Log below capacity. */
    NOT_NEEDED,
    /** Another migration was in flight; this trigger was skipped. */
    ALREADY_MIGRATING,
    /** Breaker open after repeated failures. */
    SUPPRESSED,
    COMMITTED,
    FAILED
}

package com.flagship.token_ledger.ledger;

import java.time.Duration;

/**
 * Limits shared between the ledger and its archive.
 */
public final class LedgerConstants {

    /** Transactions kept in the live log before a migration is triggered. */
    public static final int MAX_TRANSACTIONS_IN_LEDGER = 2000;

    /** Upper bound on the encoded size of one transaction, in bytes. */
    public static final int MAX_TRANSACTION_BYTES = 196;

    /** Maximum entries served by a single archive range request. */
    public static final int MAX_TRANSACTIONS_PER_REQUEST = 5000;

    public static final int MAX_MEMO_BYTES = 32;

    public static final Duration DEFAULT_TRANSACTION_WINDOW = Duration.ofHours(24);
    public static final Duration DEFAULT_PERMITTED_DRIFT = Duration.ofMinutes(2);

    private LedgerConstants() {
        // Utility class
    }
}

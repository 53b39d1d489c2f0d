package com.flagship.token_ledger.ledger;

/**
 * Callbacks fired by a {@link TokenLedger} as it commits, rejects and migrates.
 * Invoked while the ledger lock is held, so implementations must not block.
 */
public interface LedgerEventListener {

    LedgerEventListener NO_OP = new LedgerEventListener() {
    };

    default void onCommitted(Transaction transaction) {
    }

    default void onRejected(TransactionKind kind, TransferError error) {
    }

    default void onArchiveProvisioned(String archiveId, long cost) {
    }

    default void onMigrationCommitted(int batchSize, long storedTxs) {
    }

    default void onMigrationFailed(int batchSize, String reason) {
    }

    default void onMigrationSkipped(String reason) {
    }
}

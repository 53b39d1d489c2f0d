package com.flagship.token_ledger.ledger;

/**
 * Kind of a ledger operation, decided by whether the minting account is on either side.
 */
public enum TransactionKind {
    MINT,
    BURN,
    TRANSFER
}

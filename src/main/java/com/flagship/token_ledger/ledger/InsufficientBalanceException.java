package com.flagship.token_ledger.ledger;

import lombok.Getter;

/**
 * Thrown by {@link BalanceStore} when a debit exceeds the available balance.
 */
@Getter
public class InsufficientBalanceException extends IllegalStateException {

    private final long balance;
    private final long requested;

    public InsufficientBalanceException(long balance, long requested) {
        super(String.format("Insufficient balance: balance=%d, requested=%d", balance, requested));
        this.balance = balance;
        this.requested = requested;
    }
}

package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.account.Account;
import lombok.Value;

import java.util.Arrays;
import java.util.Objects;

/**
 * Committed ledger transaction.
 *
 * {@code from} is null for mints and {@code to} is null for burns.
 * {@code timestamp} is the ledger time of the commit in nanoseconds since the epoch.
 */
@Value
public class Transaction {
    long index;
    TransactionKind kind;
    Account from;
    Account to;
    long amount;
    long fee;
    byte[] memo;
    Long createdAtTime;
    long timestamp;

    static Transaction commit(TransactionRequest request, long index, long timestamp) {
        return new Transaction(
            index,
            request.getKind(),
            request.getKind() == TransactionKind.MINT ? null : request.getFrom(),
            request.getKind() == TransactionKind.BURN ? null : request.getTo(),
            request.getAmount(),
            request.getFee(),
            request.getMemo() == null ? null : request.getMemo().clone(),
            request.getCreatedAtTime(),
            timestamp
        );
    }

    public byte[] getMemo() {
        return memo == null ? null : memo.clone();
    }

    /**
     * True if this transaction carries the same caller-supplied content as the request.
     * Used for de-duplication of requests that carry a creation time.
     */
    boolean matches(TransactionRequest request) {
        return kind == request.getKind()
            && Objects.equals(from, request.getKind() == TransactionKind.MINT ? null : request.getFrom())
            && Objects.equals(to, request.getKind() == TransactionKind.BURN ? null : request.getTo())
            && amount == request.getAmount()
            && fee == request.getFee()
            && Arrays.equals(memo, request.getMemo())
            && Objects.equals(createdAtTime, request.getCreatedAtTime());
    }
}

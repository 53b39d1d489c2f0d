package com.flagship.token_ledger.archive;

import com.flagship.token_ledger.ledger.Transaction;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Remote archive that receives transactions migrated out of the live log.
 *
 * Calls are asynchronous: the ledger releases its lock while a call is pending,
 * so other operations may run before the returned future completes.
 */
public interface ArchiveClient {

    /**
     * Identifier of this archive instance, for logs and health details.
     */
    String id();

    /**
     * Appends a contiguous batch. The batch must start at {@link #totalTransactions()}.
     * Completes with a rejected ack (or exceptionally) if nothing was stored.
     */
    CompletableFuture<ArchiveAck> append(List<Transaction> batch);

    CompletableFuture<Optional<Transaction>> getTransaction(long index);

    /**
     * Returns up to {@code length} transactions starting at {@code start}, clipped to what is stored.
     * {@code length} is capped at the per-call limit.
     */
    CompletableFuture<List<Transaction>> getTransactions(long start, long length);

    long totalTransactions();

    /**
     * Remaining storage, in bytes.
     */
    long remainingCapacity();
}

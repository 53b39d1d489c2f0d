package com.flagship.token_ledger.archive;

import com.flagship.token_ledger.ledger.LedgerConstants;
import com.flagship.token_ledger.ledger.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Archive kept in process memory. Completes every call immediately.
 *
 * Entries already stored are skipped, so a batch resent after a lost ack is
 * accepted. A batch that would leave a gap is rejected.
 */
@Slf4j
public class InMemoryArchive implements ArchiveClient {

    private final String id;
    private final long maxMemoryBytes;
    private final List<Transaction> stored = new ArrayList<>();

    public InMemoryArchive(String id, long maxMemoryBytes) {
        this.id = id;
        this.maxMemoryBytes = maxMemoryBytes;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized CompletableFuture<ArchiveAck> append(List<Transaction> batch) {
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(ArchiveAck.ok());
        }
        long expected = stored.size();
        long first = batch.get(0).getIndex();
        if (first > expected) {
            log.warn("Rejected non-contiguous batch: archiveId={}, expectedIndex={}, firstIndex={}",
                    id, expected, first);
            return CompletableFuture.completedFuture(ArchiveAck.rejected(
                    String.format("Batch starts at %d, expected %d", first, expected)));
        }
        int alreadyStored = (int) Math.min(batch.size(), expected - first);
        if (alreadyStored > 0) {
            log.info("Skipping entries already archived: archiveId={}, firstIndex={}, skipped={}",
                    id, first, alreadyStored);
        }
        List<Transaction> fresh = batch.subList(alreadyStored, batch.size());
        long needed = (long) fresh.size() * LedgerConstants.MAX_TRANSACTION_BYTES;
        if (needed > remainingCapacity()) {
            return CompletableFuture.completedFuture(ArchiveAck.rejected("Archive is full"));
        }
        stored.addAll(fresh);
        log.debug("Archived batch: archiveId={}, size={}, total={}", id, batch.size(), stored.size());
        return CompletableFuture.completedFuture(ArchiveAck.ok());
    }

    @Override
    public synchronized CompletableFuture<Optional<Transaction>> getTransaction(long index) {
        if (index < 0 || index >= stored.size()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(Optional.of(stored.get((int) index)));
    }

    @Override
    public synchronized CompletableFuture<List<Transaction>> getTransactions(long start, long length) {
        long capped = Math.min(length, LedgerConstants.MAX_TRANSACTIONS_PER_REQUEST);
        if (start < 0 || capped <= 0 || start >= stored.size()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        int end = (int) Math.min(stored.size(), start + capped);
        return CompletableFuture.completedFuture(new ArrayList<>(stored.subList((int) start, end)));
    }

    @Override
    public synchronized long totalTransactions() {
        return stored.size();
    }

    @Override
    public synchronized long remainingCapacity() {
        return maxMemoryBytes - (long) stored.size() * LedgerConstants.MAX_TRANSACTION_BYTES;
    }
}

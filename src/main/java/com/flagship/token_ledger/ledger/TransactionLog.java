package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.archive.ArchiveReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Live, append-only transaction log.
 *
 * Indices are global: the first live entry has index {@code archive.storedTxs()},
 * so {@code storedTxs + size()} is both the next index and the total transaction
 * count. Entries leave the log only as a migrated prefix (or all at once via
 * {@link #clear()}), never individually.
 *
 * Not thread-safe; {@link TokenLedger} serializes access.
 */
public class TransactionLog {

    private final int capacity;
    private final ArchiveReference archive;
    private final List<Transaction> entries = new ArrayList<>();

    public TransactionLog(int capacity, ArchiveReference archive) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Log capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.archive = archive;
    }

    /**
     * Commits a validated request as the next transaction.
     *
     * @return the committed transaction, carrying its assigned index
     */
    public Transaction append(TransactionRequest request, long timestamp) {
        Transaction tx = Transaction.commit(request, nextIndex(), timestamp);
        entries.add(tx);
        return tx;
    }

    public long nextIndex() {
        return archive.storedTxs() + entries.size();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isAtCapacity() {
        return entries.size() >= capacity;
    }

    /**
     * Global index of the oldest live entry (equal to {@code storedTxs}).
     */
    public long firstIndex() {
        return archive.storedTxs();
    }

    public Optional<Transaction> get(long index) {
        long offset = index - firstIndex();
        if (offset < 0 || offset >= entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get((int) offset));
    }

    /**
     * Live entries with global index in {@code [start, start + length)}, clipped to what the log holds.
     */
    public List<Transaction> slice(long start, long length) {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("start and length must not be negative");
        }
        long from = Math.max(start, firstIndex());
        long end = Math.min(saturatingAdd(start, length), nextIndex());
        if (from >= end) {
            return Collections.emptyList();
        }
        int skip = (int) (from - firstIndex());
        int take = (int) (end - from);
        return new ArrayList<>(entries.subList(skip, skip + take));
    }

    /**
     * Copy of every live entry, oldest first.
     */
    public List<Transaction> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * Removes the oldest {@code count} entries. Called when those entries have been
     * confirmed by the archive; entries committed after the batch was taken stay.
     */
    public void discardPrefix(int count) {
        if (count < 0 || count > entries.size()) {
            throw new IllegalArgumentException(
                String.format("Cannot discard %d entries from a log of %d", count, entries.size()));
        }
        entries.subList(0, count).clear();
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Newest live transaction with the same caller-supplied content, if any.
     * Only requests carrying a creation time are de-duplicated.
     */
    public Optional<Transaction> findDuplicate(TransactionRequest request) {
        if (request.getCreatedAtTime() == null) {
            return Optional.empty();
        }
        for (int i = entries.size() - 1; i >= 0; i--) {
            Transaction tx = entries.get(i);
            if (tx.matches(request)) {
                return Optional.of(tx);
            }
        }
        return Optional.empty();
    }

    static long saturatingAdd(long a, long b) {
        long sum = a + b;
        return sum < a ? Long.MAX_VALUE : sum;
    }
}

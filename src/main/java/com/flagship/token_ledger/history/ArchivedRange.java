package com.flagship.token_ledger.history;

import com.flagship.token_ledger.archive.ArchiveClient;
import com.flagship.token_ledger.ledger.Transaction;
import lombok.Value;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Deferred fetch of archived transactions {@code [start, start + length)}.
 * The caller resolves it against {@link #getArchive()} separately.
 */
@Value
public class ArchivedRange {
    long start;
    long length;
    ArchiveClient archive;

    public CompletableFuture<List<Transaction>> fetch() {
        return archive.getTransactions(start, length);
    }
}

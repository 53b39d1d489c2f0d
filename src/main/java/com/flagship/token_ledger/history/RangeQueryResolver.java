package com.flagship.token_ledger.history;

import com.flagship.token_ledger.archive.ArchiveReference;
import com.flagship.token_ledger.ledger.Transaction;
import com.flagship.token_ledger.ledger.TransactionLog;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a window of transaction indices between the live log and the archive.
 *
 * The archived part is {@code [start, min(storedTxs, end))}, cut into chunks no
 * longer than the archive's per-call limit; the local part is
 * {@code [max(start, storedTxs), min(end, storedTxs + logSize))}. The resolver
 * never calls the archive itself. Callers hold the ledger lock.
 */
public class RangeQueryResolver {

    private final TransactionLog transactionLog;
    private final ArchiveReference archive;
    private final int maxArchiveRange;

    public RangeQueryResolver(TransactionLog transactionLog, ArchiveReference archive, int maxArchiveRange) {
        if (maxArchiveRange <= 0) {
            throw new IllegalArgumentException("maxArchiveRange must be positive: " + maxArchiveRange);
        }
        this.transactionLog = transactionLog;
        this.archive = archive;
        this.maxArchiveRange = maxArchiveRange;
    }

    public GetTransactionsResponse resolve(long start, long length) {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException(
                String.format("start and length must not be negative: start=%d, length=%d", start, length));
        }
        long storedTxs = archive.storedTxs();
        long txEnd = storedTxs + transactionLog.size();
        long end = Math.min(saturatingAdd(start, length), txEnd);

        if (start >= end) {
            return GetTransactionsResponse.empty(txEnd);
        }

        List<ArchivedRange> archived = new ArrayList<>();
        long archivedEnd = Math.min(storedTxs, end);
        for (long chunk = start; chunk < archivedEnd; chunk += maxArchiveRange) {
            long chunkLength = Math.min(maxArchiveRange, archivedEnd - chunk);
            archived.add(new ArchivedRange(chunk, chunkLength, archive.client()));
        }
        long archivedCount = Math.max(0, archivedEnd - start);

        long localStart = Math.max(start, storedTxs);
        List<Transaction> local = localStart < end
                ? transactionLog.slice(localStart, end - localStart)
                : List.of();

        return new GetTransactionsResponse(
                txEnd,
                archivedCount + local.size(),
                start,
                local,
                archived);
    }

    private static long saturatingAdd(long a, long b) {
        long sum = a + b;
        return sum < a ? Long.MAX_VALUE : sum;
    }
}

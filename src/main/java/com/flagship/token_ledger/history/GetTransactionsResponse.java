package com.flagship.token_ledger.history;

import com.flagship.token_ledger.ledger.Transaction;
import lombok.Value;

import java.util.List;

/**
 * Answer to a range query.
 *
 * {@code length} counts every matched transaction, local and archived.
 * {@code firstIndex} is {@link #NO_FIRST_INDEX} when nothing matched.
 * {@code transactions} holds the local part; {@code archivedTransactions} lists the
 * archive fetches covering the rest, in index order.
 */
@Value
public class GetTransactionsResponse {

    public static final long NO_FIRST_INDEX = Long.MAX_VALUE;

    long logLength;
    long length;
    long firstIndex;
    List<Transaction> transactions;
    List<ArchivedRange> archivedTransactions;

    static GetTransactionsResponse empty(long logLength) {
        return new GetTransactionsResponse(logLength, 0, NO_FIRST_INDEX, List.of(), List.of());
    }
}

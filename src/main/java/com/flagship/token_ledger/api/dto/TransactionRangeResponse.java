package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.history.GetTransactionsResponse;
import lombok.Value;

import java.util.List;

/**
 * JSON view of a range query. Archived parts are listed as ranges to fetch separately.
 */
@Value
public class TransactionRangeResponse {

    @JsonProperty("log_length")
    long logLength;

    @JsonProperty("length")
    long length;

    @JsonProperty("first_index")
    long firstIndex;

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    @JsonProperty("archived_transactions")
    List<ArchivedRangeResponse> archivedTransactions;

    public static TransactionRangeResponse from(GetTransactionsResponse response) {
        return new TransactionRangeResponse(
            response.getLogLength(),
            response.getLength(),
            response.getFirstIndex(),
            response.getTransactions().stream().map(TransactionResponse::from).toList(),
            response.getArchivedTransactions().stream()
                .map(range -> new ArchivedRangeResponse(range.getStart(), range.getLength(), range.getArchive().id()))
                .toList()
        );
    }

    @Value
    public static class ArchivedRangeResponse {

        @JsonProperty("start")
        long start;

        @JsonProperty("length")
        long length;

        @JsonProperty("archive_id")
        String archiveId;
    }
}

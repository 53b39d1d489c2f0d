package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.ledger.Transaction;
import com.flagship.token_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.HexFormat;

/**
 * JSON view of a committed transaction.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("index")
    long index;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("fee")
    long fee;

    @JsonProperty("memo")
    String memo;

    @JsonProperty("created_at_time")
    Long createdAtTime;

    @JsonProperty("timestamp")
    long timestamp;

    @JsonProperty("committed_at")
    Instant committedAt;

    public static TransactionResponse from(Transaction tx) {
        return TransactionResponse.builder()
            .index(tx.getIndex())
            .kind(tx.getKind())
            .from(describe(tx.getFrom()))
            .to(describe(tx.getTo()))
            .amount(tx.getAmount())
            .fee(tx.getFee())
            .memo(tx.getMemo() == null ? null : HexFormat.of().formatHex(tx.getMemo()))
            .createdAtTime(tx.getCreatedAtTime())
            .timestamp(tx.getTimestamp())
            .committedAt(Instant.ofEpochSecond(0, tx.getTimestamp()))
            .build();
    }

    private static String describe(Account account) {
        return account == null ? null : account.toString();
    }
}

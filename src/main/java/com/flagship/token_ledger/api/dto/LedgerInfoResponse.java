package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.TokenLedger;
import lombok.Builder;
import lombok.Value;

/**
 * Token metadata and ledger totals.
 */
@Value
@Builder
public class LedgerInfoResponse {

    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("decimals")
    int decimals;

    @JsonProperty("fee")
    long fee;

    @JsonProperty("minting_account")
    String mintingAccount;

    @JsonProperty("max_supply")
    long maxSupply;

    @JsonProperty("min_burn_amount")
    long minBurnAmount;

    @JsonProperty("total_supply")
    long totalSupply;

    @JsonProperty("total_minted")
    long totalMinted;

    @JsonProperty("total_burned")
    long totalBurned;

    @JsonProperty("total_transactions")
    long totalTransactions;

    @JsonProperty("archived_transactions")
    long archivedTransactions;

    @JsonProperty("archive_id")
    String archiveId;

    public static LedgerInfoResponse from(TokenLedger ledger) {
        TokenLedger.LedgerSnapshot snapshot = ledger.snapshot();
        return LedgerInfoResponse.builder()
            .name(ledger.name())
            .symbol(ledger.symbol())
            .decimals(ledger.decimals())
            .fee(ledger.fee())
            .mintingAccount(ledger.mintingAccount().toString())
            .maxSupply(ledger.maxSupply())
            .minBurnAmount(ledger.minBurnAmount())
            .totalSupply(snapshot.totalSupply())
            .totalMinted(snapshot.getTotalMinted())
            .totalBurned(snapshot.getTotalBurned())
            .totalTransactions(snapshot.totalTransactions())
            .archivedTransactions(snapshot.getStoredTxs())
            .archiveId(snapshot.getArchiveId())
            .build();
    }
}

package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.archive.MigrationState;
import com.flagship.token_ledger.ledger.TokenLedger;
import lombok.Value;

/**
 * Archive binding and migration progress.
 */
@Value
public class ArchiveInfoResponse {

    @JsonProperty("archive_id")
    String archiveId;

    @JsonProperty("stored_transactions")
    long storedTransactions;

    @JsonProperty("remaining_capacity_bytes")
    Long remainingCapacityBytes;

    @JsonProperty("migration_state")
    MigrationState migrationState;

    public static ArchiveInfoResponse from(TokenLedger.ArchiveInfo info) {
        return new ArchiveInfoResponse(
            info.getArchiveId(),
            info.getStoredTxs(),
            info.getRemainingCapacity(),
            info.getMigrationState());
    }
}

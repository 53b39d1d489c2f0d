package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request body for burns; the destination is always the minting account.
 */
@Value
@Builder
@Jacksonized
public class CreateBurnRequest {

    @Pattern(regexp = "^([0-9a-fA-F]{2})*$", message = "from_subaccount must be hex")
    @JsonProperty("from_subaccount")
    String fromSubaccount;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    Long amount;

    @Pattern(regexp = "^([0-9a-fA-F]{2})*$", message = "memo must be hex")
    @JsonProperty("memo")
    String memo;

    @JsonProperty("created_at_time")
    Long createdAtTime;
}

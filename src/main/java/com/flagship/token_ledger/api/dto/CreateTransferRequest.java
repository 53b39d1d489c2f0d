package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request body for transfers and mints. Byte fields are hex strings.
 */
@Value
@Builder
@Jacksonized
public class CreateTransferRequest {

    @Pattern(regexp = "^([0-9a-fA-F]{2})*$", message = "from_subaccount must be hex")
    @JsonProperty("from_subaccount")
    String fromSubaccount;

    @NotBlank(message = "to_owner is required")
    @JsonProperty("to_owner")
    String toOwner;

    @Pattern(regexp = "^([0-9a-fA-F]{2})*$", message = "to_subaccount must be hex")
    @JsonProperty("to_subaccount")
    String toSubaccount;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    Long amount;

    @PositiveOrZero(message = "Fee must not be negative")
    @JsonProperty("fee")
    Long fee;

    @Pattern(regexp = "^([0-9a-fA-F]{2})*$", message = "memo must be hex")
    @JsonProperty("memo")
    String memo;

    @JsonProperty("created_at_time")
    Long createdAtTime;
}

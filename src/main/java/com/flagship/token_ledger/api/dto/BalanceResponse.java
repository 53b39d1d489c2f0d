package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("account")
    String account;

    @JsonProperty("balance")
    long balance;
}

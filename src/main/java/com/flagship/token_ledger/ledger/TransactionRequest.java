package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.account.EncodedAccount;
import lombok.Value;

/**
 * A validated but not yet committed operation.
 * Only exists between validation and commit.
 */
@Value
public class TransactionRequest {
    TransactionKind kind;
    Account from;
    Account to;
    EncodedAccount encodedFrom;
    EncodedAccount encodedTo;
    long amount;
    long fee;
    byte[] memo;
    Long createdAtTime;
}

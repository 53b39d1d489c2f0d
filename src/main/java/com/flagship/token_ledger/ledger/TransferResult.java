package com.flagship.token_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either the index of the committed transaction or the reason it was rejected.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferResult {
    Long index;
    TransferError error;

    public static TransferResult ok(long index) {
        return new TransferResult(index, null);
    }

    public static TransferResult err(TransferError error) {
        return new TransferResult(null, error);
    }

    public boolean isOk() {
        return error == null;
    }
}

package com.flagship.token_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reason a transfer request was rejected.
 *
 * Only the fields relevant to {@link #getType()} are set; the rest are null.
 * Rejections are returned as values and never leave partial state behind.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferError {

    public static final long CODE_INVALID_ACCOUNT = 1;
    public static final long CODE_INVALID_MEMO = 2;
    public static final long CODE_SELF_TRANSFER = 3;
    public static final long CODE_MAX_SUPPLY = 4;
    public static final long CODE_INVALID_AMOUNT = 5;

    public enum Type {
        INSUFFICIENT_BALANCE,
        BAD_FEE,
        BAD_BURN,
        TOO_OLD,
        CREATED_IN_FUTURE,
        DUPLICATE,
        UNAUTHORIZED,
        GENERIC_ERROR
    }

    Type type;
    Long balance;
    Long expectedFee;
    Long minBurnAmount;
    Long ledgerTime;
    Long duplicateOf;
    Long errorCode;
    String message;

    public static TransferError insufficientBalance(long balance) {
        return new TransferError(Type.INSUFFICIENT_BALANCE, balance, null, null, null, null, null,
            "Insufficient balance: " + balance);
    }

    public static TransferError badFee(long expectedFee) {
        return new TransferError(Type.BAD_FEE, null, expectedFee, null, null, null, null,
            "Fee must be " + expectedFee);
    }

    public static TransferError badBurn(long minBurnAmount) {
        return new TransferError(Type.BAD_BURN, null, null, minBurnAmount, null, null, null,
            "Burn amount is below the minimum of " + minBurnAmount);
    }

    public static TransferError tooOld() {
        return new TransferError(Type.TOO_OLD, null, null, null, null, null, null,
            "Transaction is older than the transaction window");
    }

    public static TransferError createdInFuture(long ledgerTime) {
        return new TransferError(Type.CREATED_IN_FUTURE, null, null, null, ledgerTime, null, null,
            "Transaction is created in the future");
    }

    public static TransferError duplicate(long duplicateOf) {
        return new TransferError(Type.DUPLICATE, null, null, null, null, duplicateOf, null,
            "Duplicate of transaction " + duplicateOf);
    }

    public static TransferError unauthorized(String message) {
        return new TransferError(Type.UNAUTHORIZED, null, null, null, null, null, null, message);
    }

    public static TransferError generic(long errorCode, String message) {
        return new TransferError(Type.GENERIC_ERROR, null, null, null, null, null, errorCode, message);
    }

    /**
     * Non-null detail fields keyed by their wire names.
     */
    public Map<String, String> details() {
        Map<String, String> details = new LinkedHashMap<>();
        putIfPresent(details, "balance", balance);
        putIfPresent(details, "expected_fee", expectedFee);
        putIfPresent(details, "min_burn_amount", minBurnAmount);
        putIfPresent(details, "ledger_time", ledgerTime);
        putIfPresent(details, "duplicate_of", duplicateOf);
        putIfPresent(details, "error_code", errorCode);
        return details;
    }

    private static void putIfPresent(Map<String, String> details, String key, Long value) {
        if (value != null) {
            details.put(key, value.toString());
        }
    }
}

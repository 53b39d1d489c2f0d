package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

/**
 * Raw transfer arguments as submitted by a caller.
 *
 * The sending account is the caller plus {@code fromSubaccount}. {@code fee} and
 * {@code createdAtTime} (nanoseconds since the epoch) are optional.
 */
@Value
@Builder(toBuilder = true)
public class TransferArgs {
    byte[] fromSubaccount;
    Account to;
    long amount;
    Long fee;
    byte[] memo;
    Long createdAtTime;
}

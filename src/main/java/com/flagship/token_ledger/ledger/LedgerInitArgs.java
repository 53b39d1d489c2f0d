package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.account.Account;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Parameters fixed at ledger creation.
 * Checked by {@link TokenLedger}; a violation aborts construction.
 */
@Value
@Builder
public class LedgerInitArgs {
    String name;
    String symbol;
    int decimals;
    long fee;
    Account mintingAccount;
    long maxSupply;
    long minBurnAmount;
    @Singular
    Map<Account, Long> initialBalances;
    @Builder.Default
    Duration transactionWindow = LedgerConstants.DEFAULT_TRANSACTION_WINDOW;
    @Builder.Default
    Duration permittedDrift = LedgerConstants.DEFAULT_PERMITTED_DRIFT;
    @Builder.Default
    int logCapacity = LedgerConstants.MAX_TRANSACTIONS_IN_LEDGER;
    @Builder.Default
    int maxArchiveRange = LedgerConstants.MAX_TRANSACTIONS_PER_REQUEST;
}

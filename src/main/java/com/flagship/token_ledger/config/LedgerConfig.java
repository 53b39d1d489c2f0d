package com.flagship.token_ledger.config;

import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.archive.ArchiveProvisioner;
import com.flagship.token_ledger.archive.InMemoryArchiveProvisioner;
import com.flagship.token_ledger.archive.MigrationRetryPolicy;
import com.flagship.token_ledger.ledger.LedgerInitArgs;
import com.flagship.token_ledger.ledger.TokenLedger;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the ledger from {@code ledger.*} properties.
 *
 * Initial balances are given as {@code owner=amount} pairs separated by commas,
 * for example {@code alice=1000,bob=250}. An invalid combination of settings
 * fails startup.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Value("${ledger.name:Flagship Token}")
    private String name;

    @Value("${ledger.symbol:FLG}")
    private String symbol;

    @Value("${ledger.decimals:8}")
    private int decimals;

    @Value("${ledger.fee:10000}")
    private long fee;

    @Value("${ledger.max-supply:2100000000000000}")
    private long maxSupply;

    @Value("${ledger.min-burn-amount:10000}")
    private long minBurnAmount;

    @Value("${ledger.minting-account.owner:minter}")
    private String mintingOwner;

    @Value("${ledger.minting-account.subaccount:}")
    private String mintingSubaccount;

    @Value("${ledger.initial-balances:}")
    private String initialBalances;

    @Value("${ledger.transaction-window:24h}")
    private Duration transactionWindow;

    @Value("${ledger.permitted-drift:2m}")
    private Duration permittedDrift;

    @Value("${ledger.log-capacity:2000}")
    private int logCapacity;

    @Value("${ledger.archive.max-range:5000}")
    private int maxArchiveRange;

    @Value("${ledger.archive.provisioning-budget:1000000000000}")
    private long provisioningBudget;

    @Value("${ledger.archive.provisioning-cost:100000000000}")
    private long provisioningCost;

    @Value("${ledger.archive.max-memory-bytes:34359738368}")
    private long archiveMaxMemoryBytes;

    @Value("${ledger.archive.max-consecutive-failures:5}")
    private int maxConsecutiveFailures;

    @Value("${ledger.archive.retry-cooldown:30s}")
    private Duration retryCooldown;

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ArchiveProvisioner archiveProvisioner() {
        return new InMemoryArchiveProvisioner(provisioningBudget, provisioningCost, archiveMaxMemoryBytes);
    }

    @Bean
    public LedgerInitArgs ledgerInitArgs() {
        return LedgerInitArgs.builder()
                .name(name)
                .symbol(symbol)
                .decimals(decimals)
                .fee(fee)
                .maxSupply(maxSupply)
                .minBurnAmount(minBurnAmount)
                .mintingAccount(Account.of(mintingOwner, mintingSubaccount))
                .initialBalances(parseInitialBalances(initialBalances))
                .transactionWindow(transactionWindow)
                .permittedDrift(permittedDrift)
                .logCapacity(logCapacity)
                .maxArchiveRange(maxArchiveRange)
                .build();
    }

    @Bean
    public TokenLedger tokenLedger(LedgerInitArgs initArgs,
                                   ArchiveProvisioner archiveProvisioner,
                                   Clock ledgerClock,
                                   LedgerMetrics ledgerMetrics) {
        TokenLedger ledger = new TokenLedger(
                initArgs,
                archiveProvisioner,
                new MigrationRetryPolicy(maxConsecutiveFailures, retryCooldown),
                ledgerClock,
                ledgerMetrics);
        ledgerMetrics.registerLedgerGauges(ledger);
        return ledger;
    }

    static Map<Account, Long> parseInitialBalances(String value) {
        Map<Account, Long> balances = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return balances;
        }
        for (String pair : value.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("Invalid initial balance entry: " + trimmed);
            }
            String owner = trimmed.substring(0, eq).trim();
            long amount;
            try {
                amount = Long.parseLong(trimmed.substring(eq + 1).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid initial balance amount: " + trimmed, e);
            }
            balances.merge(Account.of(owner), amount, Math::addExact);
        }
        log.info("Loaded {} initial balances from configuration", balances.size());
        return balances;
    }
}

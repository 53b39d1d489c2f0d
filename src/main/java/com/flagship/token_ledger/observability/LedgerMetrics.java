package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.ledger.LedgerEventListener;
import com.flagship.token_ledger.ledger.TokenLedger;
import com.flagship.token_ledger.ledger.Transaction;
import com.flagship.token_ledger.ledger.TransactionKind;
import com.flagship.token_ledger.ledger.TransferError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for the token ledger.
 *
 * Metrics exposed:
 * - ledger.transactions: committed transactions, tagged by kind
 * - ledger.rejections: rejected requests, tagged by kind and error
 * - ledger.latency: write latency, tagged by operation
 * - ledger.migrations: archive migration attempts, tagged by outcome
 * - ledger.migrations.skipped: triggers that did not start an attempt, tagged by reason
 * - ledger.migrated.transactions: transactions moved to the archive
 * - ledger.archive.provisioned: archive instances created
 * - ledger.log.size / ledger.archive.stored / ledger.total.supply: gauges
 *
 * Also the {@link LedgerEventListener} the ledger reports to.
 */
@Component
public class LedgerMetrics implements LedgerEventListener {

    private final MeterRegistry registry;

    private final Counter migratedTransactions;
    private final Counter archivesProvisioned;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.migratedTransactions = Counter.builder("ledger.migrated.transactions")
                .description("Number of transactions moved to the archive")
                .register(registry);

        this.archivesProvisioned = Counter.builder("ledger.archive.provisioned")
                .description("Number of archive instances provisioned")
                .register(registry);
    }

    // ==================== Ledger Events ====================

    @Override
    public void onCommitted(Transaction transaction) {
        registry.counter("ledger.transactions",
                "kind", tagOf(transaction.getKind())
        ).increment();
    }

    @Override
    public void onRejected(TransactionKind kind, TransferError error) {
        registry.counter("ledger.rejections",
                "kind", tagOf(kind),
                "error", error.getType().name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    @Override
    public void onArchiveProvisioned(String archiveId, long cost) {
        archivesProvisioned.increment();
    }

    @Override
    public void onMigrationCommitted(int batchSize, long storedTxs) {
        registry.counter("ledger.migrations", "outcome", "committed").increment();
        migratedTransactions.increment(batchSize);
    }

    @Override
    public void onMigrationFailed(int batchSize, String reason) {
        registry.counter("ledger.migrations", "outcome", "failed").increment();
    }

    @Override
    public void onMigrationSkipped(String reason) {
        registry.counter("ledger.migrations.skipped", "reason", sanitizeTag(reason)).increment();
    }

    // ==================== Timer Methods ====================

    /**
     * Records write latency for one operation (transfer, mint, burn).
     */
    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Gauge Methods ====================

    /**
     * Registers gauges that read straight from the ledger. Reads are cheap and
     * never wait on the archive.
     */
    public void registerLedgerGauges(TokenLedger ledger) {
        Gauge.builder("ledger.log.size", ledger, l -> l.snapshot().getLogSize())
                .description("Transactions held in the live log")
                .register(registry);

        Gauge.builder("ledger.archive.stored", ledger, l -> l.snapshot().getStoredTxs())
                .description("Transactions confirmed by the archive")
                .register(registry);

        Gauge.builder("ledger.total.supply", ledger, TokenLedger::totalSupply)
                .description("Minted minus burned tokens, in base units")
                .register(registry);
    }

    // ==================== Helper Methods ====================

    private static String tagOf(TransactionKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.archive.MigrationRetryPolicy;
import com.flagship.token_ledger.ledger.TokenLedger;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the archive migration path.
 *
 * UP while migrations succeed, DEGRADED after failures (the log keeps
 * growing past capacity but writes still succeed), DOWN while the breaker is open.
 */
@Component("archiveHealth")
public class ArchiveHealthIndicator implements HealthIndicator {

    private final TokenLedger ledger;

    public ArchiveHealthIndicator(TokenLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Health health() {
        TokenLedger.LedgerSnapshot snapshot = ledger.snapshot();

        Health.Builder builder;
        if (snapshot.getBreakerState() == MigrationRetryPolicy.State.OPEN) {
            builder = Health.down();
        } else if (snapshot.getConsecutiveFailures() > 0) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.up();
        }

        return builder
                .withDetail("archiveId", snapshot.getArchiveId() != null ? snapshot.getArchiveId() : "unbound")
                .withDetail("storedTxs", snapshot.getStoredTxs())
                .withDetail("logSize", snapshot.getLogSize())
                .withDetail("logCapacity", snapshot.getLogCapacity())
                .withDetail("migrationState", snapshot.getMigrationState().name())
                .withDetail("breakerState", snapshot.getBreakerState().name())
                .withDetail("consecutiveFailures", snapshot.getConsecutiveFailures())
                .build();
    }
}

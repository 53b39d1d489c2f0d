package com.flagship.token_ledger.archive;

import com.flagship.token_ledger.ledger.LedgerEventListener;
import com.flagship.token_ledger.ledger.Transaction;
import com.flagship.token_ledger.ledger.TransactionLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Moves the live log to the archive once it reaches capacity.
 *
 * Runs as a post-commit hook. Per attempt:
 * IDLE -> PROVISIONING (first time only) -> TRANSMITTING -> committed or failed -> IDLE.
 *
 * The capacity check and the switch out of IDLE happen in one step under the
 * ledger lock, so at most one batch is ever in flight. The lock is released while
 * the archive works and reacquired to apply the result. On success
 * {@code storedTxs} grows by the batch size and the same number of entries leaves
 * the log, in one step. On failure nothing changes and the next commit retries,
 * subject to {@link MigrationRetryPolicy}. Failures never reach the committing caller.
 */
@Slf4j
public class ArchiveMigrationCoordinator {

    private final TransactionLog transactionLog;
    private final ArchiveReference archive;
    private final ArchiveProvisioner provisioner;
    private final MigrationRetryPolicy retryPolicy;
    private final Lock lock;
    private final Clock clock;
    private final LedgerEventListener listener;

    private MigrationState state = MigrationState.IDLE;

    public ArchiveMigrationCoordinator(TransactionLog transactionLog,
                                       ArchiveReference archive,
                                       ArchiveProvisioner provisioner,
                                       MigrationRetryPolicy retryPolicy,
                                       Lock lock,
                                       Clock clock,
                                       LedgerEventListener listener) {
        this.transactionLog = transactionLog;
        this.archive = archive;
        this.provisioner = provisioner;
        this.retryPolicy = retryPolicy;
        this.lock = lock;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Starts a migration if the log is at capacity and none is in flight.
     *
     * @return completes once this attempt is committed or failed; already complete
     *         when no attempt was started
     */
    public CompletableFuture<MigrationOutcome> afterCommit() {
        List<Transaction> batch;
        boolean needsProvisioning;
        lock.lock();
        try {
            if (!transactionLog.isAtCapacity()) {
                return CompletableFuture.completedFuture(MigrationOutcome.NOT_NEEDED);
            }
            if (state.isMigrating()) {
                log.debug("Migration already in flight, skipping trigger: state={}, logSize={}",
                        state, transactionLog.size());
                listener.onMigrationSkipped("in_flight");
                return CompletableFuture.completedFuture(MigrationOutcome.ALREADY_MIGRATING);
            }
            if (!retryPolicy.allowAttempt(clock.instant())) {
                listener.onMigrationSkipped("breaker_open");
                return CompletableFuture.completedFuture(MigrationOutcome.SUPPRESSED);
            }
            batch = transactionLog.snapshot();
            needsProvisioning = !archive.isBound();
            state = needsProvisioning ? MigrationState.PROVISIONING : MigrationState.TRANSMITTING;
        } finally {
            lock.unlock();
        }

        log.info("Starting archive migration: batchSize={}, firstIndex={}, provisioning={}",
                batch.size(), batch.get(0).getIndex(), needsProvisioning);

        CompletableFuture<ArchiveClient> target = needsProvisioning
                ? safely(provisioner::provision).thenApply(this::bind)
                : safely(() -> CompletableFuture.completedFuture(currentClient()));

        return target
                .thenCompose(client -> transmit(client, batch))
                .handle((ack, error) -> complete(batch, ack, error));
    }

    public MigrationState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public MigrationRetryPolicy retryPolicy() {
        return retryPolicy;
    }

    private ArchiveClient bind(ArchiveClient client) {
        lock.lock();
        try {
            archive.bind(client);
            state = MigrationState.TRANSMITTING;
            listener.onArchiveProvisioned(client.id(), provisioner.provisioningCost());
            return client;
        } finally {
            lock.unlock();
        }
    }

    private ArchiveClient currentClient() {
        lock.lock();
        try {
            return archive.client();
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<ArchiveAck> transmit(ArchiveClient client, List<Transaction> batch) {
        log.debug("Transmitting batch to archive: archiveId={}, batchSize={}", client.id(), batch.size());
        return safely(() -> client.append(batch));
    }

    private MigrationOutcome complete(List<Transaction> batch, ArchiveAck ack, Throwable error) {
        lock.lock();
        try {
            if (error == null && ack != null && ack.isSuccess()) {
                long expectedFirst = transactionLog.firstIndex();
                if (batch.get(0).getIndex() != expectedFirst) {
                    // Cannot happen while attempts are serialized; refuse rather than corrupt indices.
                    return fail(batch, String.format("Batch starts at %d but the log starts at %d",
                            batch.get(0).getIndex(), expectedFirst));
                }
                archive.recordStored(batch.size());
                transactionLog.discardPrefix(batch.size());
                retryPolicy.recordSuccess();
                listener.onMigrationCommitted(batch.size(), archive.storedTxs());
                log.info("Archive migration committed: batchSize={}, storedTxs={}, logSize={}",
                        batch.size(), archive.storedTxs(), transactionLog.size());
                return MigrationOutcome.COMMITTED;
            }
            return fail(batch, describe(ack, error));
        } finally {
            state = MigrationState.IDLE;
            lock.unlock();
        }
    }

    private MigrationOutcome fail(List<Transaction> batch, String reason) {
        retryPolicy.recordFailure(clock.instant());
        listener.onMigrationFailed(batch.size(), reason);
        log.warn("Archive migration failed, will retry on a later commit: batchSize={}, consecutiveFailures={}, reason={}",
                batch.size(), retryPolicy.consecutiveFailures(), reason);
        return MigrationOutcome.FAILED;
    }

    private static String describe(ArchiveAck ack, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        if (ack == null) {
            return "archive returned no acknowledgment";
        }
        return ack.getMessage() != null ? ack.getMessage() : "archive rejected the batch";
    }

    /**
     * Turns a synchronous throw from a remote call into a failed future.
     */
    private static <T> CompletableFuture<T> safely(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("archive call returned no result"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}

package com.flagship.token_ledger.archive;

import com.flagship.token_ledger.LedgerFixtures;
import com.flagship.token_ledger.MutableClock;
import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.ledger.LedgerEventListener;
import com.flagship.token_ledger.ledger.LedgerInitArgs;
import com.flagship.token_ledger.ledger.TokenLedger;
import com.flagship.token_ledger.ledger.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.flagship.token_ledger.LedgerFixtures.pay;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Tests for moving the live log into the archive.
 *
 * These tests verify that:
 * - A failed migration leaves storedTxs and the log untouched
 * - Failures never reach the committing caller
 * - Repeated failures open the breaker, which half-opens after the cooldown
 * - At most one batch is in flight; commits made meanwhile are kept
 * - The archive is provisioned once, on the first migration
 */
class ArchiveMigrationCoordinatorTest {

    private static final Account ALICE = Account.of("alice");

    private MutableClock clock;
    private ArchiveProvisioner provisioner;
    private ArchiveClient client;
    private LedgerEventListener listener;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(LedgerFixtures.START);
        provisioner = mock(ArchiveProvisioner.class);
        client = mock(ArchiveClient.class);
        listener = mock(LedgerEventListener.class);
        when(client.id()).thenReturn("mock-archive");
        when(provisioner.provisioningCost()).thenReturn(100L);
        when(provisioner.provision()).thenReturn(CompletableFuture.completedFuture(client));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private TokenLedger ledger(int capacity, ArchiveProvisioner archiveProvisioner) {
        LedgerInitArgs args = LedgerFixtures.defaults()
                .initialBalance(ALICE, 1_000_000L)
                .logCapacity(capacity)
                .build();
        return new TokenLedger(args, archiveProvisioner, new MigrationRetryPolicy(2, Duration.ofSeconds(30)),
                clock, listener);
    }

    private MigrationOutcome commit(TokenLedger ledger) {
        TokenLedger.CommitReceipt receipt = ledger.transferAndMigrate(pay("bob", 1), "alice");
        assertTrue(receipt.getResult().isOk(), "Commit must succeed regardless of the archive");
        return receipt.getMigration().join();
    }

    @Test
    @DisplayName("Rejected batch leaves storedTxs and the log untouched")
    void testFailedMigration_NoStateChange() {
        printTestHeader("Failed Migration - No State Change");

        when(client.append(anyList())).thenReturn(CompletableFuture.completedFuture(ArchiveAck.rejected("disk full")));
        TokenLedger ledger = ledger(3, provisioner);

        assertEquals(MigrationOutcome.NOT_NEEDED, commit(ledger));
        assertEquals(MigrationOutcome.NOT_NEEDED, commit(ledger));
        assertEquals(MigrationOutcome.FAILED, commit(ledger));

        TokenLedger.LedgerSnapshot snapshot = ledger.snapshot();
        System.out.println("Snapshot: " + snapshot);

        assertEquals(0, snapshot.getStoredTxs());
        assertEquals(3, snapshot.getLogSize());
        assertEquals(MigrationState.IDLE, snapshot.getMigrationState());
        assertEquals(1, snapshot.getConsecutiveFailures());
        assertEquals("mock-archive", snapshot.getArchiveId(), "Binding survives a failed transmit");
        assertTrue(ledger.getTransaction(0).join().isPresent(), "Entries are still served locally");
        verify(listener).onMigrationFailed(3, "disk full");
        verify(listener, never()).onMigrationCommitted(anyInt(), anyLong());

        printSuccess("storedTxs still 0, log still holds 3 entries");
    }

    @Test
    @DisplayName("Breaker opens after repeated failures and half-opens after the cooldown")
    void testBreaker_OpensAndRecovers() {
        printTestHeader("Breaker - Opens And Recovers");

        when(client.append(anyList())).thenReturn(
                CompletableFuture.completedFuture(ArchiveAck.rejected("unavailable")),
                CompletableFuture.completedFuture(ArchiveAck.rejected("unavailable")),
                CompletableFuture.completedFuture(ArchiveAck.ok()));
        TokenLedger ledger = ledger(3, provisioner);
        commit(ledger);
        commit(ledger);

        assertEquals(MigrationOutcome.FAILED, commit(ledger));
        assertEquals(MigrationOutcome.FAILED, commit(ledger));
        assertEquals(MigrationRetryPolicy.State.OPEN, ledger.snapshot().getBreakerState());

        assertEquals(MigrationOutcome.SUPPRESSED, commit(ledger));
        verify(listener).onMigrationSkipped("breaker_open");

        clock.advance(Duration.ofSeconds(31));
        assertEquals(MigrationRetryPolicy.State.HALF_OPEN, ledger.snapshot().getBreakerState());
        assertEquals(MigrationOutcome.COMMITTED, commit(ledger));

        TokenLedger.LedgerSnapshot snapshot = ledger.snapshot();
        System.out.println("Snapshot: " + snapshot);
        assertEquals(6, snapshot.getStoredTxs());
        assertEquals(0, snapshot.getLogSize());
        assertEquals(MigrationRetryPolicy.State.CLOSED, snapshot.getBreakerState());
        assertEquals(0, snapshot.getConsecutiveFailures());
        verify(client, times(3)).append(anyList());
        verify(provisioner, times(1)).provision();

        printSuccess("Two failures opened the breaker, the half-open attempt stored 6 transactions");
    }

    @Test
    @DisplayName("Archive exceptions are treated as failed migrations")
    void testArchiveException_IsFailure() {
        when(client.append(anyList()))
                .thenThrow(new IllegalStateException("connection refused"))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("connection reset")));
        TokenLedger ledger = ledger(2, provisioner);
        commit(ledger);

        assertEquals(MigrationOutcome.FAILED, commit(ledger));
        assertEquals(MigrationOutcome.FAILED, commit(ledger));

        verify(listener).onMigrationFailed(2, "connection refused");
        verify(listener).onMigrationFailed(3, "connection reset");
        assertEquals(MigrationState.IDLE, ledger.snapshot().getMigrationState());
        assertEquals(3, ledger.snapshot().getLogSize());
    }

    @Test
    @DisplayName("Failed provisioning leaves the archive unbound and is retried")
    void testProvisioningFailure() {
        InMemoryArchiveProvisioner poor = new InMemoryArchiveProvisioner(50, 100, 1L << 20);
        TokenLedger ledger = ledger(2, poor);
        commit(ledger);

        assertEquals(MigrationOutcome.FAILED, commit(ledger));

        TokenLedger.LedgerSnapshot snapshot = ledger.snapshot();
        assertNull(snapshot.getArchiveId());
        assertEquals(0, snapshot.getStoredTxs());
        assertEquals(2, snapshot.getLogSize());
        assertEquals(0, poor.provisionedCount());
        assertEquals(50, poor.remainingBudget());
        verify(listener, never()).onArchiveProvisioned(anyString(), anyLong());
    }

    @Test
    @DisplayName("Archive is provisioned once and reused by later migrations")
    void testProvisionedOnce() {
        InMemoryArchiveProvisioner inMemory = new InMemoryArchiveProvisioner(1_000, 100, 1L << 20);
        TokenLedger ledger = ledger(3, inMemory);

        for (int i = 0; i < 9; i++) {
            commit(ledger);
        }

        assertEquals(9, ledger.snapshot().getStoredTxs());
        assertEquals(1, inMemory.provisionedCount());
        assertEquals(900, inMemory.remainingBudget());
        verify(listener, times(1)).onArchiveProvisioned("archive-1", 100L);
        verify(listener).onMigrationCommitted(3, 9L);
    }

    @Test
    @DisplayName("Commits during an in-flight migration are kept and migrated later")
    void testInFlightMigration_KeepsLaterCommits() {
        printTestHeader("In-Flight Migration - Keeps Later Commits");

        ManualArchive archive = new ManualArchive();
        when(provisioner.provision()).thenReturn(CompletableFuture.completedFuture(archive));
        TokenLedger ledger = ledger(3, provisioner);
        commit(ledger);
        commit(ledger);

        TokenLedger.CommitReceipt third = ledger.transferAndMigrate(pay("bob", 1), "alice");
        assertFalse(third.getMigration().isDone(), "Batch should still be in flight");
        assertEquals(MigrationState.TRANSMITTING, ledger.snapshot().getMigrationState());
        assertEquals(List.of(0L, 1L, 2L), archive.peekPendingBatch().stream().map(Transaction::getIndex).toList());

        // Commit while the archive has not answered
        TokenLedger.CommitReceipt fourth = ledger.transferAndMigrate(pay("bob", 1), "alice");
        assertEquals(3L, fourth.getResult().getIndex());
        assertEquals(MigrationOutcome.ALREADY_MIGRATING, fourth.getMigration().join());
        assertEquals(1, archive.receivedBatches());
        assertEquals(4, ledger.snapshot().getLogSize());

        archive.acknowledgeNext();

        assertEquals(MigrationOutcome.COMMITTED, third.getMigration().join());
        TokenLedger.LedgerSnapshot snapshot = ledger.snapshot();
        System.out.println("After ack: " + snapshot);
        assertEquals(3, snapshot.getStoredTxs());
        assertEquals(1, snapshot.getLogSize());
        assertEquals(MigrationState.IDLE, snapshot.getMigrationState());
        assertEquals(3, ledger.getTransaction(3).join().orElseThrow().getIndex());
        assertEquals(0, ledger.getTransaction(0).join().orElseThrow().getIndex());

        // Next batch starts where the first one ended
        commit(ledger);
        TokenLedger.CommitReceipt sixth = ledger.transferAndMigrate(pay("bob", 1), "alice");
        assertEquals(List.of(3L, 4L, 5L), archive.peekPendingBatch().stream().map(Transaction::getIndex).toList());
        archive.rejectNext("timeout");
        assertEquals(MigrationOutcome.FAILED, sixth.getMigration().join());
        assertEquals(3, ledger.snapshot().getStoredTxs());

        TokenLedger.CommitReceipt seventh = ledger.transferAndMigrate(pay("bob", 1), "alice");
        assertEquals(4, archive.peekPendingBatch().size());
        archive.acknowledgeNext();
        assertEquals(MigrationOutcome.COMMITTED, seventh.getMigration().join());

        snapshot = ledger.snapshot();
        assertEquals(7, snapshot.getStoredTxs());
        assertEquals(0, snapshot.getLogSize());
        assertEquals(7, snapshot.totalTransactions());
        assertEquals(0, archive.pendingCount());

        printSuccess("One batch in flight at a time, no commit lost, storedTxs = 7");
    }

    @Test
    @DisplayName("Batch stored but unacknowledged is resent and completed by the next migration")
    void testLostAck_ResendSucceeds() {
        InMemoryArchive archive = new InMemoryArchive("lossy-archive", 1L << 20) {
            private boolean dropAck = true;

            @Override
            public synchronized CompletableFuture<ArchiveAck> append(List<Transaction> batch) {
                ArchiveAck ack = super.append(batch).join();
                if (dropAck) {
                    dropAck = false;
                    return CompletableFuture.failedFuture(new RuntimeException("ack lost"));
                }
                return CompletableFuture.completedFuture(ack);
            }
        };
        when(provisioner.provision()).thenReturn(CompletableFuture.completedFuture(archive));
        TokenLedger ledger = ledger(3, provisioner);
        commit(ledger);
        commit(ledger);

        assertEquals(MigrationOutcome.FAILED, commit(ledger));
        assertEquals(0, ledger.snapshot().getStoredTxs());
        assertEquals(3, archive.totalTransactions());

        assertEquals(MigrationOutcome.COMMITTED, commit(ledger));

        TokenLedger.LedgerSnapshot snapshot = ledger.snapshot();
        assertEquals(4, snapshot.getStoredTxs());
        assertEquals(0, snapshot.getLogSize());
        assertEquals(4, archive.totalTransactions());
        assertEquals(3, ledger.getTransaction(3).join().orElseThrow().getIndex());
        verify(listener).onMigrationFailed(3, "ack lost");
    }
}

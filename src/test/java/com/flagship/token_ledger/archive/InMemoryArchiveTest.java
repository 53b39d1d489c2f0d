package com.flagship.token_ledger.archive;

import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.ledger.LedgerConstants;
import com.flagship.token_ledger.ledger.Transaction;
import com.flagship.token_ledger.ledger.TransactionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryArchiveTest {

    private static final Account ALICE = Account.of("alice");
    private static final Account BOB = Account.of("bob");

    private static List<Transaction> batch(long firstIndex, int size) {
        List<Transaction> batch = new ArrayList<>();
        for (long i = firstIndex; i < firstIndex + size; i++) {
            batch.add(new Transaction(i, TransactionKind.TRANSFER, ALICE, BOB, 1, 10, null, null, 0));
        }
        return batch;
    }

    @Test
    @DisplayName("Contiguous batches are stored and readable by index")
    void testAppend_Contiguous() {
        InMemoryArchive archive = new InMemoryArchive("archive-1", 1L << 20);

        assertTrue(archive.append(batch(0, 3)).join().isSuccess());
        assertTrue(archive.append(batch(3, 2)).join().isSuccess());

        assertEquals(5, archive.totalTransactions());
        assertEquals(4, archive.getTransaction(4).join().orElseThrow().getIndex());
        assertTrue(archive.getTransaction(5).join().isEmpty());
        assertEquals(List.of(1L, 2L, 3L),
                archive.getTransactions(1, 3).join().stream().map(Transaction::getIndex).toList());
        assertEquals(2, archive.getTransactions(3, 100).join().size());
        assertTrue(archive.getTransactions(9, 1).join().isEmpty());
    }

    @Test
    @DisplayName("Batch that would leave a gap is rejected")
    void testAppend_Gap() {
        InMemoryArchive archive = new InMemoryArchive("archive-1", 1L << 20);
        archive.append(batch(0, 2)).join();

        ArchiveAck gap = archive.append(batch(3, 1)).join();

        assertFalse(gap.isSuccess());
        assertEquals("Batch starts at 3, expected 2", gap.getMessage());
        assertEquals(2, archive.totalTransactions());
    }

    @Test
    @DisplayName("Resent batch skips entries already stored")
    void testAppend_ResentAfterLostAck() {
        InMemoryArchive archive = new InMemoryArchive("archive-1", 1L << 20);
        archive.append(batch(0, 3)).join();

        assertTrue(archive.append(batch(0, 3)).join().isSuccess(), "Same batch again");
        assertEquals(3, archive.totalTransactions());

        assertTrue(archive.append(batch(0, 5)).join().isSuccess(), "Batch grown since the lost ack");
        assertEquals(5, archive.totalTransactions());
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L),
                archive.getTransactions(0, 10).join().stream().map(Transaction::getIndex).toList());
    }

    @Test
    @DisplayName("Capacity check counts only entries not yet stored")
    void testAppend_ResentNearFull() {
        InMemoryArchive archive = new InMemoryArchive("archive-1", 3L * LedgerConstants.MAX_TRANSACTION_BYTES);
        archive.append(batch(0, 2)).join();

        assertTrue(archive.append(batch(0, 3)).join().isSuccess());
        assertEquals(3, archive.totalTransactions());
        assertEquals(0, archive.remainingCapacity());
    }

    @Test
    @DisplayName("Batch beyond the memory limit is rejected")
    void testAppend_Full() {
        InMemoryArchive archive = new InMemoryArchive("archive-1", 2L * LedgerConstants.MAX_TRANSACTION_BYTES);

        assertTrue(archive.append(batch(0, 2)).join().isSuccess());
        ArchiveAck full = archive.append(batch(2, 1)).join();

        assertFalse(full.isSuccess());
        assertEquals("Archive is full", full.getMessage());
        assertEquals(0, archive.remainingCapacity());
    }

    @Test
    @DisplayName("Provisioner charges its budget and refuses once exhausted")
    void testProvisioner_Budget() {
        InMemoryArchiveProvisioner provisioner = new InMemoryArchiveProvisioner(250, 100, 1L << 20);

        assertEquals("archive-1", provisioner.provision().join().id());
        assertEquals("archive-2", provisioner.provision().join().id());
        assertTrue(provisioner.provision().isCompletedExceptionally());
        assertEquals(50, provisioner.remainingBudget());
        assertEquals(2, provisioner.provisionedCount());
    }

    @Test
    @DisplayName("Binding an archive twice is refused")
    void testReference_BindOnce() {
        ArchiveReference reference = new ArchiveReference();
        assertFalse(reference.isBound());
        assertSame(ArchiveBinding.UNBOUND, reference.binding());
        assertThrows(IllegalStateException.class, reference::client);

        InMemoryArchive archive = new InMemoryArchive("archive-1", 1L << 20);
        reference.bind(archive);

        assertSame(archive, reference.client());
        assertThrows(IllegalStateException.class, () -> reference.bind(archive));
    }
}

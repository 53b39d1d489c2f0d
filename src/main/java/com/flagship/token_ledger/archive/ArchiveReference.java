package com.flagship.token_ledger.archive;

import lombok.extern.slf4j.Slf4j;

/**
 * The ledger's handle on its archive plus the count of transactions durably stored there.
 *
 * {@code storedTxs} only grows, and only after the archive acknowledged a batch.
 * Together with the live log size it gives the total number of transactions.
 * Not thread-safe; guarded by the ledger lock.
 */
@Slf4j
public class ArchiveReference {

    private ArchiveBinding binding = ArchiveBinding.UNBOUND;
    private long storedTxs;

    public ArchiveBinding binding() {
        return binding;
    }

    public boolean isBound() {
        return binding instanceof ArchiveBinding.Bound;
    }

    /**
     * @throws IllegalStateException if no archive has been provisioned yet
     */
    public ArchiveClient client() {
        if (binding instanceof ArchiveBinding.Bound bound) {
            return bound.client();
        }
        throw new IllegalStateException("Archive is not bound yet");
    }

    public void bind(ArchiveClient client) {
        if (isBound()) {
            throw new IllegalStateException("Archive is already bound to " + client().id());
        }
        binding = ArchiveBinding.bound(client);
        log.info("Bound ledger archive: archiveId={}", client.id());
    }

    public long storedTxs() {
        return storedTxs;
    }

    void recordStored(int batchSize) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("Batch size must not be negative: " + batchSize);
        }
        storedTxs += batchSize;
    }
}

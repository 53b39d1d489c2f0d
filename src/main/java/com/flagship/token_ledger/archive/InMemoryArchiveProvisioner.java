package com.flagship.token_ledger.archive;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates {@link InMemoryArchive} instances, charging a fixed cost against a finite budget.
 */
@Slf4j
public class InMemoryArchiveProvisioner implements ArchiveProvisioner {

    private final long provisioningCost;
    private final long maxMemoryBytes;
    private final AtomicLong remainingBudget;
    private final AtomicInteger provisioned = new AtomicInteger();

    public InMemoryArchiveProvisioner(long budget, long provisioningCost, long maxMemoryBytes) {
        if (provisioningCost < 0 || budget < 0) {
            throw new IllegalArgumentException("Budget and provisioning cost must not be negative");
        }
        this.provisioningCost = provisioningCost;
        this.maxMemoryBytes = maxMemoryBytes;
        this.remainingBudget = new AtomicLong(budget);
    }

    @Override
    public CompletableFuture<ArchiveClient> provision() {
        long before = remainingBudget.getAndUpdate(b -> b >= provisioningCost ? b - provisioningCost : b);
        if (before < provisioningCost) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    String.format("Insufficient budget to provision an archive: remaining=%d, cost=%d",
                            before, provisioningCost)));
        }
        String id = "archive-" + provisioned.incrementAndGet();
        log.info("Provisioned archive: archiveId={}, cost={}, remainingBudget={}",
                id, provisioningCost, remainingBudget.get());
        return CompletableFuture.completedFuture(new InMemoryArchive(id, maxMemoryBytes));
    }

    @Override
    public long provisioningCost() {
        return provisioningCost;
    }

    public long remainingBudget() {
        return remainingBudget.get();
    }

    public int provisionedCount() {
        return provisioned.get();
    }
}

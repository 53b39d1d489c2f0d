package com.flagship.token_ledger.archive;

import java.util.concurrent.CompletableFuture;

/**
 * Allocates a fresh archive instance. Each allocation consumes a fixed resource budget.
 */
public interface ArchiveProvisioner {

    CompletableFuture<ArchiveClient> provision();

    /**
     * Budget consumed by one {@link #provision()} call.
     */
    long provisioningCost();
}

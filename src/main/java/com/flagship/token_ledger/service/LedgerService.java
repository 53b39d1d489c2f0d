package com.flagship.token_ledger.service;

import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.history.ArchivedRange;
import com.flagship.token_ledger.history.GetTransactionsResponse;
import com.flagship.token_ledger.ledger.TokenLedger;
import com.flagship.token_ledger.ledger.Transaction;
import com.flagship.token_ledger.ledger.TransferArgs;
import com.flagship.token_ledger.ledger.TransferResult;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Entry point for ledger writes and history reads from the HTTP layer.
 *
 * Adds logging, MDC and latency metrics around {@link TokenLedger}, and resolves
 * archived history synchronously (the archive calls are awaited here so
 * controllers stay blocking).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final TokenLedger ledger;
    private final LedgerMetrics ledgerMetrics;

    public TransferResult transfer(TransferArgs args, String caller) {
        return timed("transfer", args, caller, ledger::transfer);
    }

    public TransferResult mint(TransferArgs args, String caller) {
        return timed("mint", args, caller, ledger::mint);
    }

    public TransferResult burn(TransferArgs args, String caller) {
        return timed("burn", args, caller, ledger::burn);
    }

    public long balanceOf(Account account) {
        return ledger.balanceOf(account);
    }

    public TokenLedger.LedgerSnapshot snapshot() {
        return ledger.snapshot();
    }

    public TokenLedger.ArchiveInfo archiveInfo() {
        return ledger.archiveInfo();
    }

    public TokenLedger ledger() {
        return ledger;
    }

    /**
     * Looks up a transaction in the live log or, for older indices, in the archive.
     */
    public Optional<Transaction> getTransaction(long index) {
        return ledger.getTransaction(index).join();
    }

    /**
     * Range query without touching the archive: archived parts come back as descriptors.
     */
    public GetTransactionsResponse getTransactions(long start, long length) {
        return ledger.getTransactions(start, length);
    }

    /**
     * Range query with every archived descriptor fetched, in index order.
     */
    public List<Transaction> getTransactionsResolved(long start, long length) {
        GetTransactionsResponse response = ledger.getTransactions(start, length);

        List<CompletableFuture<List<Transaction>>> fetches = response.getArchivedTransactions().stream()
                .map(ArchivedRange::fetch)
                .toList();
        CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0])).join();

        List<Transaction> result = new ArrayList<>((int) response.getLength());
        for (CompletableFuture<List<Transaction>> fetch : fetches) {
            result.addAll(fetch.join());
        }
        result.addAll(response.getTransactions());

        log.debug("Resolved transaction range: start={}, length={}, archivedRanges={}, returned={}",
                start, length, fetches.size(), result.size());
        return result;
    }

    private TransferResult timed(String operation, TransferArgs args, String caller,
                                 BiFunction<TransferArgs, String, TransferResult> call) {
        long startTime = System.currentTimeMillis();
        log.info("Received {} request: caller={}, amount={}, to={}", operation, caller, args.getAmount(), args.getTo());

        try {
            TransferResult result = call.apply(args, caller);
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordLatency(operation, duration);

            if (result.isOk()) {
                CorrelationContext.bindTxIndex(result.getIndex());
                log.info("{} committed: index={}, amount={}, duration={}ms",
                        operation, result.getIndex(), args.getAmount(), duration);
            } else {
                log.info("{} rejected: error={}, message={}, duration={}ms",
                        operation, result.getError().getType(), result.getError().getMessage(), duration);
            }
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordLatency(operation, duration);
            log.error("{} failed: error={}, duration={}ms", operation, e.getMessage(), duration);
            throw e;
        }
    }
}

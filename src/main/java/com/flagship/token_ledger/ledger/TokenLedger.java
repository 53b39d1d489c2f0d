package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.account.AccountCodec;
import com.flagship.token_ledger.archive.ArchiveClient;
import com.flagship.token_ledger.archive.ArchiveMigrationCoordinator;
import com.flagship.token_ledger.archive.ArchiveProvisioner;
import com.flagship.token_ledger.archive.ArchiveReference;
import com.flagship.token_ledger.archive.MigrationOutcome;
import com.flagship.token_ledger.archive.MigrationRetryPolicy;
import com.flagship.token_ledger.archive.MigrationState;
import com.flagship.token_ledger.history.GetTransactionsResponse;
import com.flagship.token_ledger.history.RangeQueryResolver;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fungible-token ledger: balances, the live transaction log and the archive handle.
 *
 * All state lives in this instance; nothing is static, so independent ledgers can
 * coexist. A single lock serializes commits and reads. The only place an operation
 * waits on something external is the archive migration that may follow a commit,
 * and that happens with the lock released (see {@link ArchiveMigrationCoordinator}).
 *
 * Key invariants:
 * - sum(balances) + totalBurned == totalMinted
 * - storedTxs + log size == totalTransactions
 * - indices are gapless and assigned in commit order
 */
@Slf4j
public class TokenLedger {

    private final LedgerInitArgs settings;
    private final Clock clock;
    private final LedgerEventListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private final BalanceStore balances = new BalanceStore();
    private final ArchiveReference archive = new ArchiveReference();
    private final TransactionLog transactionLog;
    private final TransferValidator validator;
    private final ArchiveMigrationCoordinator coordinator;
    private final RangeQueryResolver resolver;

    public TokenLedger(LedgerInitArgs settings,
                       ArchiveProvisioner provisioner,
                       MigrationRetryPolicy retryPolicy,
                       Clock clock,
                       LedgerEventListener listener) {
        checkInitArgs(settings);
        this.settings = settings;
        this.clock = clock;
        this.listener = listener;
        this.transactionLog = new TransactionLog(settings.getLogCapacity(), archive);
        this.validator = new TransferValidator(settings, balances, transactionLog);
        this.coordinator = new ArchiveMigrationCoordinator(
                transactionLog, archive, provisioner, retryPolicy, lock, clock, listener);
        this.resolver = new RangeQueryResolver(transactionLog, archive, settings.getMaxArchiveRange());

        for (Map.Entry<Account, Long> entry : settings.getInitialBalances().entrySet()) {
            balances.mint(entry.getKey().encode(), entry.getValue());
        }
        log.info("Initialized ledger: name={}, symbol={}, fee={}, mintingAccount={}, initialSupply={}",
                settings.getName(), settings.getSymbol(), settings.getFee(),
                settings.getMintingAccount(), balances.totalSupply());
    }

    // ==================== Write API ====================

    /**
     * Validates and commits a transfer, mint or burn, depending on which side the
     * minting account is on. A successful commit may start an archive migration,
     * whose outcome never affects the result returned here.
     */
    public TransferResult transfer(TransferArgs args, String caller) {
        return transferAndMigrate(args, caller).getResult();
    }

    /**
     * Same as {@link #transfer} but also returns the migration attempt the commit triggered.
     */
    public CommitReceipt transferAndMigrate(TransferArgs args, String caller) {
        TransferResult result;
        lock.lock();
        try {
            result = commit(args, caller);
        } finally {
            lock.unlock();
        }
        CompletableFuture<MigrationOutcome> migration = result.isOk()
                ? coordinator.afterCommit()
                : CompletableFuture.completedFuture(MigrationOutcome.NOT_NEEDED);
        return new CommitReceipt(result, migration);
    }

    /**
     * Mints to {@code args.to}. Only the owner of the minting account may call this.
     */
    public TransferResult mint(TransferArgs args, String caller) {
        Account minting = settings.getMintingAccount();
        if (!minting.getOwner().equals(caller)) {
            TransferError error = TransferError.unauthorized("Only the minting account owner can mint");
            listener.onRejected(TransactionKind.MINT, error);
            return TransferResult.err(error);
        }
        return transfer(args.toBuilder().fromSubaccount(minting.getSubaccount()).build(), caller);
    }

    /**
     * Burns from the caller's account by sending to the minting account.
     */
    public TransferResult burn(TransferArgs args, String caller) {
        return transfer(args.toBuilder().to(settings.getMintingAccount()).fee(null).build(), caller);
    }

    private TransferResult commit(TransferArgs args, String caller) {
        long now = nowNanos();
        TransferValidator.Validation validation = validator.validate(args, caller, now);
        if (!validation.isAccepted()) {
            TransferError error = validation.getError();
            TransactionKind kind = AccountCodec.isValid(args.getTo()) && caller != null
                    ? validator.classify(Account.of(caller, args.getFromSubaccount()), args.getTo())
                    : TransactionKind.TRANSFER;
            listener.onRejected(kind, error);
            log.debug("Rejected transfer: caller={}, kind={}, error={}", caller, kind, error.getType());
            return TransferResult.err(error);
        }

        TransactionRequest request = validation.getRequest();
        switch (request.getKind()) {
            case MINT -> balances.mint(request.getEncodedTo(), request.getAmount());
            case BURN -> balances.burn(request.getEncodedFrom(), request.getAmount());
            case TRANSFER -> balances.transfer(request.getEncodedFrom(), request.getEncodedTo(),
                    request.getAmount(), request.getFee());
        }
        Transaction tx = transactionLog.append(request, now);
        listener.onCommitted(tx);
        log.debug("Committed transaction: index={}, kind={}, amount={}", tx.getIndex(), tx.getKind(), tx.getAmount());
        return TransferResult.ok(tx.getIndex());
    }

    // ==================== Read API ====================

    public String name() {
        return settings.getName();
    }

    public String symbol() {
        return settings.getSymbol();
    }

    public int decimals() {
        return settings.getDecimals();
    }

    public long fee() {
        return settings.getFee();
    }

    public Account mintingAccount() {
        return settings.getMintingAccount();
    }

    public long maxSupply() {
        return settings.getMaxSupply();
    }

    public long minBurnAmount() {
        return settings.getMinBurnAmount();
    }

    public long balanceOf(Account account) {
        lock.lock();
        try {
            return balances.balanceOf(account.encode());
        } finally {
            lock.unlock();
        }
    }

    public long totalSupply() {
        lock.lock();
        try {
            return balances.totalSupply();
        } finally {
            lock.unlock();
        }
    }

    public long totalTransactions() {
        lock.lock();
        try {
            return transactionLog.nextIndex();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Looks up one transaction, from the archive when {@code index < storedTxs}.
     */
    public CompletableFuture<Optional<Transaction>> getTransaction(long index) {
        ArchiveClient client;
        lock.lock();
        try {
            if (index < 0) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            if (index >= archive.storedTxs()) {
                return CompletableFuture.completedFuture(transactionLog.get(index));
            }
            client = archive.client();
        } finally {
            lock.unlock();
        }
        return client.getTransaction(index);
    }

    public GetTransactionsResponse getTransactions(long start, long length) {
        lock.lock();
        try {
            return resolver.resolve(start, length);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The archive this ledger migrates to, if one has been provisioned.
     * Remaining capacity is asked of the archive after the lock is released.
     */
    public ArchiveInfo archiveInfo() {
        ArchiveClient client;
        long storedTxs;
        lock.lock();
        try {
            storedTxs = archive.storedTxs();
            if (!archive.isBound()) {
                return new ArchiveInfo(null, storedTxs, null, coordinator.state());
            }
            client = archive.client();
        } finally {
            lock.unlock();
        }
        return new ArchiveInfo(client.id(), storedTxs, client.remainingCapacity(), coordinator.state());
    }

    /**
     * Consistent view of counters, for health checks, metrics and audits.
     */
    public LedgerSnapshot snapshot() {
        lock.lock();
        try {
            MigrationRetryPolicy policy = coordinator.retryPolicy();
            return new LedgerSnapshot(
                    balances.totalMinted(),
                    balances.totalBurned(),
                    balances.sumOfBalances(),
                    balances.accountCount(),
                    archive.storedTxs(),
                    transactionLog.size(),
                    transactionLog.capacity(),
                    archive.isBound() ? archive.client().id() : null,
                    coordinator.state(),
                    policy.state(clock.instant()),
                    policy.consecutiveFailures());
        } finally {
            lock.unlock();
        }
    }

    private long nowNanos() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    private static void checkInitArgs(LedgerInitArgs args) {
        String problem = AccountCodec.describeProblem(args.getMintingAccount());
        if (problem != null) {
            throw new IllegalArgumentException("Invalid minting account: " + problem);
        }
        if (args.getDecimals() < 0 || args.getDecimals() > 18) {
            throw new IllegalArgumentException("Decimals must be between 0 and 18: " + args.getDecimals());
        }
        if (args.getFee() < 0) {
            throw new IllegalArgumentException("Fee must not be negative: " + args.getFee());
        }
        if (args.getMaxArchiveRange() < 1 || args.getMaxArchiveRange() > LedgerConstants.MAX_TRANSACTIONS_PER_REQUEST) {
            throw new IllegalArgumentException(String.format("Max archive range must be between 1 and %d: %d",
                    LedgerConstants.MAX_TRANSACTIONS_PER_REQUEST, args.getMaxArchiveRange()));
        }
        if (args.getMinBurnAmount() < 0) {
            throw new IllegalArgumentException("Min burn amount must not be negative: " + args.getMinBurnAmount());
        }
        BigInteger oneUnit = BigInteger.TEN.pow(args.getDecimals());
        if (BigInteger.valueOf(args.getMaxSupply()).compareTo(oneUnit) < 0) {
            throw new IllegalArgumentException(String.format(
                    "Max supply %d is smaller than one token (%s base units)", args.getMaxSupply(), oneUnit));
        }
        BigInteger initialSupply = BigInteger.ZERO;
        for (Map.Entry<Account, Long> entry : args.getInitialBalances().entrySet()) {
            String accountProblem = AccountCodec.describeProblem(entry.getKey());
            if (accountProblem != null) {
                throw new IllegalArgumentException("Invalid initial balance account: " + accountProblem);
            }
            if (entry.getKey().equals(args.getMintingAccount())) {
                throw new IllegalArgumentException("The minting account cannot hold a balance");
            }
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("Initial balance must not be negative for " + entry.getKey());
            }
            initialSupply = initialSupply.add(BigInteger.valueOf(entry.getValue()));
        }
        if (initialSupply.compareTo(BigInteger.valueOf(args.getMaxSupply())) > 0) {
            throw new IllegalArgumentException(String.format(
                    "Initial balances (%s) exceed the max supply of %d", initialSupply, args.getMaxSupply()));
        }
        if (args.getTransactionWindow() == null || args.getTransactionWindow().isNegative()
                || args.getPermittedDrift() == null || args.getPermittedDrift().isNegative()) {
            throw new IllegalArgumentException("Transaction window and permitted drift must not be negative");
        }
    }

    /**
     * Result of a commit plus the migration attempt it may have started.
     */
    @Value
    public static class CommitReceipt {
        TransferResult result;
        CompletableFuture<MigrationOutcome> migration;
    }

    @Value
    public static class ArchiveInfo {
        String archiveId;
        long storedTxs;
        Long remainingCapacity;
        MigrationState migrationState;

        public boolean isBound() {
            return archiveId != null;
        }
    }

    @Value
    public static class LedgerSnapshot {
        long totalMinted;
        long totalBurned;
        long sumOfBalances;
        int accountCount;
        long storedTxs;
        int logSize;
        int logCapacity;
        String archiveId;
        MigrationState migrationState;
        MigrationRetryPolicy.State breakerState;
        int consecutiveFailures;

        public long totalSupply() {
            return totalMinted - totalBurned;
        }

        public long totalTransactions() {
            return storedTxs + logSize;
        }

        public boolean isConserved() {
            return sumOfBalances + totalBurned == totalMinted;
        }
    }
}

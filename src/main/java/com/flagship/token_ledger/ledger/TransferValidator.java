package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.account.AccountCodec;

/**
 * Classifies raw transfer arguments and checks them against ledger policy.
 *
 * Read-only: inspects balances and the live log but never mutates them.
 * Checks run in a fixed order and the first failure wins:
 * account and memo shape, fee, supply cap, balance, creation time,
 * duplicates, minimum burn.
 */
public class TransferValidator {

    private final LedgerInitArgs settings;
    private final BalanceStore balances;
    private final TransactionLog transactionLog;

    public TransferValidator(LedgerInitArgs settings, BalanceStore balances, TransactionLog transactionLog) {
        this.settings = settings;
        this.balances = balances;
        this.transactionLog = transactionLog;
    }

    public TransactionKind classify(Account from, Account to) {
        Account minting = settings.getMintingAccount();
        if (minting.equals(from)) {
            return TransactionKind.MINT;
        }
        if (minting.equals(to)) {
            return TransactionKind.BURN;
        }
        return TransactionKind.TRANSFER;
    }

    /**
     * Validates a transfer submitted by {@code caller}.
     *
     * @param nowNanos current ledger time in nanoseconds since the epoch
     */
    public Validation validate(TransferArgs args, String caller, long nowNanos) {
        Account from = Account.of(caller, args.getFromSubaccount());
        Account to = args.getTo();

        String problem = AccountCodec.describeProblem(from);
        if (problem == null) {
            problem = AccountCodec.describeProblem(to);
        }
        if (problem != null) {
            return Validation.rejected(TransferError.generic(TransferError.CODE_INVALID_ACCOUNT, problem));
        }
        if (args.getMemo() != null && args.getMemo().length > LedgerConstants.MAX_MEMO_BYTES) {
            return Validation.rejected(TransferError.generic(TransferError.CODE_INVALID_MEMO,
                "Memo must not exceed " + LedgerConstants.MAX_MEMO_BYTES + " bytes"));
        }
        if (from.equals(to)) {
            return Validation.rejected(TransferError.generic(TransferError.CODE_SELF_TRANSFER,
                "From and to accounts must be different"));
        }
        if (args.getAmount() < 0) {
            return Validation.rejected(TransferError.generic(TransferError.CODE_INVALID_AMOUNT,
                "Amount must not be negative"));
        }

        TransactionKind kind = classify(from, to);
        long amount = args.getAmount();

        long fee;
        switch (kind) {
            case TRANSFER -> {
                if (args.getFee() != null && args.getFee() != settings.getFee()) {
                    return Validation.rejected(TransferError.badFee(settings.getFee()));
                }
                fee = settings.getFee();
            }
            case MINT, BURN -> {
                if (args.getFee() != null && args.getFee() != 0) {
                    return Validation.rejected(TransferError.badFee(0));
                }
                fee = 0;
            }
            default -> throw new IllegalStateException("Unknown transaction kind: " + kind);
        }

        if (kind == TransactionKind.MINT && amount > settings.getMaxSupply() - balances.totalSupply()) {
            return Validation.rejected(TransferError.generic(TransferError.CODE_MAX_SUPPLY,
                String.format("Minting %d would exceed the max supply of %d", amount, settings.getMaxSupply())));
        }

        if (kind != TransactionKind.MINT) {
            long balance = balances.balanceOf(from.encode());
            if (!BalanceStore.covers(balance, amount, fee)) {
                return Validation.rejected(TransferError.insufficientBalance(balance));
            }
        }

        if (args.getCreatedAtTime() != null) {
            TransferError timeError = checkCreatedAtTime(args.getCreatedAtTime(), nowNanos);
            if (timeError != null) {
                return Validation.rejected(timeError);
            }
        }

        TransactionRequest request = new TransactionRequest(
            kind,
            from,
            to,
            from.encode(),
            to.encode(),
            amount,
            fee,
            args.getMemo() == null ? null : args.getMemo().clone(),
            args.getCreatedAtTime()
        );

        var duplicate = transactionLog.findDuplicate(request);
        if (duplicate.isPresent()) {
            return Validation.rejected(TransferError.duplicate(duplicate.get().getIndex()));
        }

        if (kind == TransactionKind.BURN && amount < settings.getMinBurnAmount()) {
            return Validation.rejected(TransferError.badBurn(settings.getMinBurnAmount()));
        }

        return Validation.accepted(request);
    }

    private TransferError checkCreatedAtTime(long createdAtTime, long nowNanos) {
        long drift = settings.getPermittedDrift().toNanos();
        long window = settings.getTransactionWindow().toNanos();
        if (createdAtTime < nowNanos - window - drift) {
            return TransferError.tooOld();
        }
        if (createdAtTime > nowNanos + drift) {
            return TransferError.createdInFuture(nowNanos);
        }
        return null;
    }

    /**
     * Outcome of {@link #validate}: exactly one of request and error is set.
     */
    @lombok.Value
    public static class Validation {
        TransactionRequest request;
        TransferError error;

        static Validation accepted(TransactionRequest request) {
            return new Validation(request, null);
        }

        static Validation rejected(TransferError error) {
            return new Validation(null, error);
        }

        public boolean isAccepted() {
            return error == null;
        }
    }
}

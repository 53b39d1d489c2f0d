package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.account.EncodedAccount;

import java.util.HashMap;
import java.util.Map;

/**
 * Balances by encoded account plus the minted and burned counters.
 *
 * Key invariant: sum(balances) + totalBurned == totalMinted.
 * Every operation checks before it writes, so a failed call leaves no trace.
 * Accounts whose balance drops to zero are removed from the map.
 *
 * Not thread-safe; {@link TokenLedger} serializes access.
 */
public class BalanceStore {

    private final Map<EncodedAccount, Long> balances = new HashMap<>();
    private long totalMinted;
    private long totalBurned;

    public long balanceOf(EncodedAccount account) {
        return balances.getOrDefault(account, 0L);
    }

    public void mint(EncodedAccount to, long amount) {
        requireNonNegative(amount);
        long updated = Math.addExact(balanceOf(to), amount);
        totalMinted = Math.addExact(totalMinted, amount);
        put(to, updated);
    }

    public void burn(EncodedAccount from, long amount) {
        requireNonNegative(amount);
        long balance = balanceOf(from);
        if (balance < amount) {
            throw new InsufficientBalanceException(balance, amount);
        }
        put(from, balance - amount);
        totalBurned += amount;
    }

    /**
     * Moves {@code amount} from one account to another and burns {@code fee} from the sender.
     */
    public void transfer(EncodedAccount from, EncodedAccount to, long amount, long fee) {
        requireNonNegative(amount);
        requireNonNegative(fee);
        long balance = balanceOf(from);
        if (!covers(balance, amount, fee)) {
            throw new InsufficientBalanceException(balance, amount + fee);
        }
        put(from, balance - fee - amount);
        put(to, Math.addExact(balanceOf(to), amount));
        totalBurned += fee;
    }

    /**
     * True if {@code balance >= amount + fee}, without overflowing.
     */
    public static boolean covers(long balance, long amount, long fee) {
        return balance >= fee && balance - fee >= amount;
    }

    public long totalMinted() {
        return totalMinted;
    }

    public long totalBurned() {
        return totalBurned;
    }

    public long totalSupply() {
        return totalMinted - totalBurned;
    }

    public int accountCount() {
        return balances.size();
    }

    /**
     * Sum of all stored balances. Linear in the number of accounts; meant for audits and tests.
     */
    public long sumOfBalances() {
        return balances.values().stream().mapToLong(Long::longValue).sum();
    }

    private void put(EncodedAccount account, long balance) {
        if (balance == 0) {
            balances.remove(account);
        } else {
            balances.put(account, balance);
        }
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
    }
}

package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.LedgerFixtures;
import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.archive.ArchiveReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.flagship.token_ledger.LedgerFixtures.MINTER;
import static com.flagship.token_ledger.LedgerFixtures.MINTING_ACCOUNT;
import static com.flagship.token_ledger.LedgerFixtures.pay;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for transfer classification and validation.
 *
 * These tests verify that:
 * - Each rejection kind is reported with its details
 * - Checks run in a fixed order, first failure wins
 * - Validation never mutates balances or the log
 */
class TransferValidatorTest {

    private static final long NOW = 1_700_000_000_000_000_000L;
    private static final long WINDOW = LedgerConstants.DEFAULT_TRANSACTION_WINDOW.toNanos();
    private static final long DRIFT = LedgerConstants.DEFAULT_PERMITTED_DRIFT.toNanos();

    private static final Account ALICE = Account.of("alice");
    private static final Account BOB = Account.of("bob");

    private BalanceStore balances;
    private TransactionLog transactionLog;
    private TransferValidator validator;

    @BeforeEach
    void setUp() {
        LedgerInitArgs settings = LedgerFixtures.defaults().maxSupply(10_000).build();
        balances = new BalanceStore();
        transactionLog = new TransactionLog(settings.getLogCapacity(), new ArchiveReference());
        validator = new TransferValidator(settings, balances, transactionLog);
        balances.mint(ALICE.encode(), 1000);
    }

    private TransferError rejection(TransferArgs args, String caller) {
        TransferValidator.Validation validation = validator.validate(args, caller, NOW);
        assertFalse(validation.isAccepted(), "Expected a rejection");
        assertNull(validation.getRequest());
        return validation.getError();
    }

    // ==================== Classification ====================

    @Test
    @DisplayName("Classifies by which side the minting account is on")
    void testClassify() {
        assertEquals(TransactionKind.MINT, validator.classify(MINTING_ACCOUNT, ALICE));
        assertEquals(TransactionKind.BURN, validator.classify(ALICE, MINTING_ACCOUNT));
        assertEquals(TransactionKind.TRANSFER, validator.classify(ALICE, BOB));
    }

    @Test
    @DisplayName("Accepted transfer carries the ledger fee and encoded accounts")
    void testAccepted_Transfer() {
        TransferValidator.Validation validation = validator.validate(pay("bob", 100), "alice", NOW);

        assertTrue(validation.isAccepted());
        TransactionRequest request = validation.getRequest();
        assertEquals(TransactionKind.TRANSFER, request.getKind());
        assertEquals(10, request.getFee());
        assertEquals(ALICE.encode(), request.getEncodedFrom());
        assertEquals(BOB.encode(), request.getEncodedTo());
        assertEquals(1000, balances.balanceOf(ALICE.encode()), "Validation must not mutate balances");
        assertEquals(0, transactionLog.size());
    }

    // ==================== Shape checks ====================

    @Test
    @DisplayName("Subaccount of the wrong length is an invalid account")
    void testInvalidSubaccount() {
        TransferArgs args = pay("bob", 10).toBuilder().fromSubaccount(new byte[5]).build();

        TransferError error = rejection(args, "alice");

        assertEquals(TransferError.Type.GENERIC_ERROR, error.getType());
        assertEquals(TransferError.CODE_INVALID_ACCOUNT, error.getErrorCode());
    }

    @Test
    @DisplayName("Memo longer than 32 bytes is rejected")
    void testMemoTooLong() {
        TransferArgs tooLong = pay("bob", 10).toBuilder().memo(new byte[33]).build();
        TransferArgs maxLength = pay("bob", 10).toBuilder().memo(new byte[32]).build();

        assertEquals(TransferError.CODE_INVALID_MEMO, rejection(tooLong, "alice").getErrorCode());
        assertTrue(validator.validate(maxLength, "alice", NOW).isAccepted());
    }

    @Test
    @DisplayName("Transfer to self is rejected")
    void testSelfTransfer() {
        assertEquals(TransferError.CODE_SELF_TRANSFER, rejection(pay("alice", 10), "alice").getErrorCode());
    }

    @Test
    @DisplayName("Negative amount is rejected")
    void testNegativeAmount() {
        assertEquals(TransferError.CODE_INVALID_AMOUNT, rejection(pay("bob", -1), "alice").getErrorCode());
    }

    // ==================== Fee ====================

    @Test
    @DisplayName("Wrong fee reports the expected fee")
    void testBadFee() {
        TransferArgs args = pay("bob", 10).toBuilder().fee(5L).build();

        TransferError error = rejection(args, "alice");

        assertEquals(TransferError.Type.BAD_FEE, error.getType());
        assertEquals(10L, error.getExpectedFee());
        assertTrue(validator.validate(pay("bob", 10).toBuilder().fee(10L).build(), "alice", NOW).isAccepted());
    }

    @Test
    @DisplayName("Mint with a non-zero fee expects zero")
    void testBadFee_Mint() {
        TransferArgs args = pay("bob", 10).toBuilder().fee(10L).build();

        TransferError error = rejection(args, MINTER);

        assertEquals(TransferError.Type.BAD_FEE, error.getType());
        assertEquals(0L, error.getExpectedFee());
    }

    // ==================== Balance and supply ====================

    @Test
    @DisplayName("Amount plus fee above balance is insufficient")
    void testInsufficientBalance() {
        TransferError error = rejection(pay("bob", 991), "alice");

        assertEquals(TransferError.Type.INSUFFICIENT_BALANCE, error.getType());
        assertEquals(1000L, error.getBalance());
    }

    @Test
    @DisplayName("Amount near Long.MAX_VALUE does not overflow the balance check")
    void testInsufficientBalance_NoOverflow() {
        TransferError error = rejection(pay("bob", Long.MAX_VALUE - 5), "alice");

        assertEquals(TransferError.Type.INSUFFICIENT_BALANCE, error.getType());
    }

    @Test
    @DisplayName("Mint beyond the max supply is rejected")
    void testMaxSupply() {
        TransferError error = rejection(pay("bob", 9_001), MINTER);

        assertEquals(TransferError.CODE_MAX_SUPPLY, error.getErrorCode());
        assertTrue(validator.validate(pay("bob", 9_000), MINTER, NOW).isAccepted());
    }

    // ==================== Creation time ====================

    @Test
    @DisplayName("Creation time before the window is too old")
    void testTooOld() {
        TransferArgs tooOld = pay("bob", 10).toBuilder().createdAtTime(NOW - WINDOW - DRIFT - 1).build();
        TransferArgs oldest = pay("bob", 10).toBuilder().createdAtTime(NOW - WINDOW - DRIFT).build();

        assertEquals(TransferError.Type.TOO_OLD, rejection(tooOld, "alice").getType());
        assertTrue(validator.validate(oldest, "alice", NOW).isAccepted());
    }

    @Test
    @DisplayName("Creation time beyond the drift is in the future")
    void testCreatedInFuture() {
        TransferArgs future = pay("bob", 10).toBuilder().createdAtTime(NOW + DRIFT + 1).build();
        TransferArgs latest = pay("bob", 10).toBuilder().createdAtTime(NOW + DRIFT).build();

        TransferError error = rejection(future, "alice");

        assertEquals(TransferError.Type.CREATED_IN_FUTURE, error.getType());
        assertEquals(NOW, error.getLedgerTime());
        assertTrue(validator.validate(latest, "alice", NOW).isAccepted());
    }

    // ==================== Duplicates and burns ====================

    @Test
    @DisplayName("Committed request with the same content and creation time is a duplicate")
    void testDuplicate() {
        TransferArgs args = pay("bob", 10).toBuilder().createdAtTime(NOW).build();
        TransferValidator.Validation first = validator.validate(args, "alice", NOW);
        transactionLog.append(first.getRequest(), NOW);

        TransferError error = rejection(args, "alice");

        assertEquals(TransferError.Type.DUPLICATE, error.getType());
        assertEquals(0L, error.getDuplicateOf());

        TransferArgs otherMemo = args.toBuilder().memo(new byte[]{1}).build();
        assertTrue(validator.validate(otherMemo, "alice", NOW).isAccepted());
    }

    @Test
    @DisplayName("Burn below the minimum is BadBurn")
    void testBadBurn() {
        TransferArgs args = TransferArgs.builder().to(MINTING_ACCOUNT).amount(49).build();

        TransferError error = rejection(args, "alice");

        assertEquals(TransferError.Type.BAD_BURN, error.getType());
        assertEquals(50L, error.getMinBurnAmount());
    }

    // ==================== Ordering ====================

    @Test
    @DisplayName("Fee is checked before balance")
    void testOrder_FeeBeforeBalance() {
        TransferArgs args = pay("bob", 5_000).toBuilder().fee(1L).build();

        assertEquals(TransferError.Type.BAD_FEE, rejection(args, "alice").getType());
    }

    @Test
    @DisplayName("Balance is checked before creation time")
    void testOrder_BalanceBeforeTime() {
        TransferArgs args = pay("bob", 5_000).toBuilder().createdAtTime(NOW - WINDOW - DRIFT - 1).build();

        assertEquals(TransferError.Type.INSUFFICIENT_BALANCE, rejection(args, "alice").getType());
    }

    @Test
    @DisplayName("Balance is checked before the minimum burn")
    void testOrder_BalanceBeforeBurn() {
        TransferArgs args = TransferArgs.builder().to(MINTING_ACCOUNT).amount(10).build();

        assertEquals(TransferError.Type.INSUFFICIENT_BALANCE, rejection(args, "carol").getType());
    }
}

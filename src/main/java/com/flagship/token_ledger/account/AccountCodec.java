package com.flagship.token_ledger.account;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Canonicalizes accounts into comparable byte keys.
 *
 * Layout: owner length (1 byte), owner UTF-8 bytes, then the subaccount bytes
 * only when the subaccount is present and not all zeros. Malformed accounts
 * still encode (so they can be compared and reported), but {@link #isValid}
 * rejects them.
 */
public final class AccountCodec {

    public static final int SUBACCOUNT_LENGTH = 32;
    public static final int MAX_OWNER_LENGTH = 63;

    private AccountCodec() {
        // Utility class
    }

    static EncodedAccount encode(String owner, byte[] subaccount) {
        byte[] ownerBytes = owner == null ? new byte[0] : owner.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(1 + ownerBytes.length + SUBACCOUNT_LENGTH);
        out.write(Math.min(ownerBytes.length, 0xFF));
        out.write(ownerBytes, 0, ownerBytes.length);
        if (subaccount != null && !isDefaultSubaccount(subaccount)) {
            out.write(subaccount, 0, subaccount.length);
        }
        return new EncodedAccount(out.toByteArray());
    }

    public static boolean isValid(Account account) {
        if (account == null) {
            return false;
        }
        String owner = account.getOwner();
        if (owner == null || owner.isBlank() || owner.length() > MAX_OWNER_LENGTH) {
            return false;
        }
        byte[] subaccount = account.getSubaccount();
        return subaccount == null || subaccount.length == SUBACCOUNT_LENGTH;
    }

    /**
     * Describes why an account is malformed, or returns null if it is valid.
     */
    public static String describeProblem(Account account) {
        if (account == null) {
            return "account is required";
        }
        String owner = account.getOwner();
        if (owner == null || owner.isBlank()) {
            return "account owner is blank";
        }
        if (owner.length() > MAX_OWNER_LENGTH) {
            return "account owner exceeds " + MAX_OWNER_LENGTH + " characters";
        }
        byte[] subaccount = account.getSubaccount();
        if (subaccount != null && subaccount.length != SUBACCOUNT_LENGTH) {
            return "subaccount must be " + SUBACCOUNT_LENGTH + " bytes, got " + subaccount.length;
        }
        return null;
    }

    static boolean isDefaultSubaccount(byte[] subaccount) {
        for (byte b : subaccount) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }
}

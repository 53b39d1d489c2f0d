package com.flagship.token_ledger.account;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.HexFormat;

/**
 * Ledger account: an owner plus an optional 32-byte subaccount.
 *
 * Two accounts are the same account only when their encodings are equal,
 * so equality is defined on the encoded form (an all-zero subaccount and
 * no subaccount encode identically). Use {@link AccountCodec} to check
 * whether an account is well formed before using it as a balance key.
 */
@Getter
@EqualsAndHashCode(of = "encoded")
public final class Account {

    private final String owner;
    private final byte[] subaccount;
    @Getter(lombok.AccessLevel.NONE)
    private final EncodedAccount encoded;

    private Account(String owner, byte[] subaccount) {
        this.owner = owner;
        this.subaccount = subaccount == null ? null : subaccount.clone();
        this.encoded = AccountCodec.encode(owner, this.subaccount);
    }

    public static Account of(String owner) {
        return new Account(owner, null);
    }

    public static Account of(String owner, byte[] subaccount) {
        return new Account(owner, subaccount);
    }

    /**
     * Parses a subaccount given as hex; a null or blank value means the default subaccount.
     */
    public static Account of(String owner, String subaccountHex) {
        if (subaccountHex == null || subaccountHex.isBlank()) {
            return of(owner);
        }
        return of(owner, HexFormat.of().parseHex(subaccountHex));
    }

    public byte[] getSubaccount() {
        return subaccount == null ? null : subaccount.clone();
    }

    public EncodedAccount encode() {
        return encoded;
    }

    /**
     * Same owner, different subaccount.
     */
    public Account withSubaccount(byte[] other) {
        return new Account(owner, other);
    }

    public boolean hasDefaultSubaccount() {
        return subaccount == null || AccountCodec.isDefaultSubaccount(subaccount);
    }

    @Override
    public String toString() {
        if (hasDefaultSubaccount()) {
            return String.valueOf(owner);
        }
        return owner + "." + HexFormat.of().formatHex(subaccount);
    }
}

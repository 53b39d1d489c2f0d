package com.flagship.token_ledger.account;

import lombok.EqualsAndHashCode;

import java.util.HexFormat;

/**
 * Canonical byte encoding of an {@link Account}, used as the balance key.
 * Compared by exact byte equality.
 */
@EqualsAndHashCode
public final class EncodedAccount {

    private final byte[] bytes;

    EncodedAccount(byte[] bytes) {
        this.bytes = bytes;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HexFormat.of().formatHex(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}

package com.flagship.token_ledger.archive;

import lombok.Value;

/**
 * Archive reply to an append. Only {@code success == true} means the batch is durable.
 */
@Value
public class ArchiveAck {
    boolean success;
    String message;

    public static ArchiveAck ok() {
        return new ArchiveAck(true, null);
    }

    public static ArchiveAck rejected(String message) {
        return new ArchiveAck(false, message);
    }
}

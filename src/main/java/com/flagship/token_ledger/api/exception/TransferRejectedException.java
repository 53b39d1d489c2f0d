package com.flagship.token_ledger.api.exception;

import com.flagship.token_ledger.ledger.TransferError;
import lombok.Getter;

/**
 * Carries a ledger rejection out of a controller so the handler can render it.
 */
@Getter
public class TransferRejectedException extends RuntimeException {

    private final TransferError error;

    public TransferRejectedException(TransferError error) {
        super(error.getMessage());
        this.error = error;
    }
}

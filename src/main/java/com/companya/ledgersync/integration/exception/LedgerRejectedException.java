package com.companya.ledgersync.integration.exception;

/**
 * The ledger API refused the write (4xx, unexpected status or {@code success:false}). Resubmitting
 * the same body will fail again.
 */
public class LedgerRejectedException extends LedgerException {

    public LedgerRejectedException(String message) {
        super(message);
    }

    public LedgerRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}

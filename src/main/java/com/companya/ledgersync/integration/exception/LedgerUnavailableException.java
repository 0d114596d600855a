package com.companya.ledgersync.integration.exception;

/**
 * The ledger API could not be reached or failed on its side (5xx, I/O, unreadable response).
 */
public class LedgerUnavailableException extends LedgerException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

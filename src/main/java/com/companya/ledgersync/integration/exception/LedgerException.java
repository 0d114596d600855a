package com.companya.ledgersync.integration.exception;

/**
 * Base for failures of a ledger write call.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}

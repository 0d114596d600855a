package com.companya.ledgersync.integration;

/**
 * Parsed reply of the ledger write API.
 *
 * @param success         the {@code success} flag of the reply
 * @param blockNumber     block that includes the transaction, when reported
 * @param transactionHash transaction hash, when reported
 * @param message         {@code error} or {@code message} text, when reported
 */
public record LedgerResponse(boolean success, Long blockNumber, String transactionHash, String message) {
}

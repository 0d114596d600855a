package com.companya.ledgersync.dispatch;

import com.companya.ledgersync.model.ForwardingPayload;
import com.companya.ledgersync.model.NormalizedRecord;
import com.companya.ledgersync.model.Operation;

import java.time.Instant;

/**
 * One accepted event waiting to be written to the ledger.
 *
 * @param tableName        source table
 * @param record           normalized record
 * @param payload          body and statistics for the ledger call
 * @param url              absolute URL of the table endpoint
 * @param eventTimestampMs when the change happened at the source
 * @param busTimestampMs   when the broker stored the message
 * @param receivedAt       when the consumer accepted the message
 */
public record ForwardingRequest(
        String tableName,
        NormalizedRecord record,
        ForwardingPayload payload,
        String url,
        long eventTimestampMs,
        long busTimestampMs,
        Instant receivedAt) {

    public Operation operation() {
        return record.operation();
    }
}

package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.Table;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.DatabaseFamily;
import com.companya.ledgersync.model.ForwardingPayload;
import com.companya.ledgersync.model.NormalizedRecord;
import com.companya.ledgersync.model.Operation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Normalizes raw change data of one database family into a {@link NormalizedRecord}.
 * Implementations hold no state beyond their app configuration and never perform I/O.
 */
public interface SourceAdapter {

    DatabaseFamily family();

    /**
     * Picks the image that describes the record, or {@code null} when the envelope has none.
     */
    JsonNode rowImage(ChangeEnvelope envelope);

    /**
     * An explicit operation marker always wins. Without one the result is a best-effort guess from
     * the deleted marker and the created/modified timestamps; it is never authoritative.
     */
    Operation detectOperation(ChangeEnvelope envelope, JsonNode data);

    /**
     * Converts any of the family's time encodings into an instant. Never throws: absent or
     * unparseable input yields the current time.
     */
    Instant normalizeTimestamp(JsonNode raw);

    /**
     * @return the identity field value, or {@code <table>_<receivedAt millis>} when the row has none
     */
    String extractRecordId(String tableName, JsonNode data, Instant receivedAt);

    boolean hasNaturalId(JsonNode data);

    ObjectNode filterFields(Table table, JsonNode data);

    Instant createdTimestamp(JsonNode data);

    Instant modifiedTimestamp(JsonNode data);

    String modifiedBy(JsonNode data);

    /**
     * Time the change happened at the source, in epoch millis, for latency accounting.
     * Falls back to the broker timestamp.
     */
    long eventTimestampMs(ChangeEnvelope envelope, JsonNode data);

    NormalizedRecord normalize(ChangeEnvelope envelope, Table table, JsonNode data);

    ForwardingPayload transformForLedger(Table table, NormalizedRecord record, JsonNode raw);
}

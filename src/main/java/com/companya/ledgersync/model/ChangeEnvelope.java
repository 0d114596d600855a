package com.companya.ledgersync.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Raw unit received from the change stream, either a Debezium envelope
 * ({@code {"payload": {"op", "before", "after", "source", "ts_ms"}}}) or a bare row image.
 *
 * @param streamName     topic the message was read from
 * @param operationCode  explicit operation marker, {@code null} when the message carries none
 * @param before         row image before the change, may be {@code null}
 * @param after          row image after the change, may be {@code null}
 * @param sourceTsMs     source-reported commit time ({@code payload.source.ts_ms})
 * @param envelopeTsMs   connector processing time ({@code payload.ts_ms})
 * @param busTimestampMs timestamp the broker assigned to the message
 * @param receivedAt     when the pipeline accepted the message
 * @param root           the whole parsed message, for family-specific lookups
 */
public record ChangeEnvelope(
        String streamName,
        String operationCode,
        JsonNode before,
        JsonNode after,
        Long sourceTsMs,
        Long envelopeTsMs,
        long busTimestampMs,
        Instant receivedAt,
        JsonNode root) {

    /**
     * The image describing the record: {@code after}, or {@code before} for deletes.
     */
    public JsonNode rowImage() {
        if (after != null && after.isObject()) {
            return after;
        }
        if (before != null && before.isObject()) {
            return before;
        }
        return null;
    }

    /**
     * Table name encoded as the last segment of {@code <prefix>.<database>.<table>}.
     */
    public String tableName() {
        int idx = streamName.lastIndexOf('.');
        return idx >= 0 ? streamName.substring(idx + 1) : streamName;
    }
}

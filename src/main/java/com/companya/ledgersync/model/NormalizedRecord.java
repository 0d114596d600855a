package com.companya.ledgersync.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Canonical shape an adapter produces from a {@link ChangeEnvelope}.
 *
 * @param recordId   stable identity within the source table, never empty
 * @param createdAt  creation instant, timezone-corrected
 * @param modifiedAt modification instant, timezone-corrected
 * @param modifiedBy actor that made the change, {@code "system"} when absent
 * @param operation  canonical operation
 * @param fields     filtered field set, insertion ordered
 */
public record NormalizedRecord(
        String recordId,
        Instant createdAt,
        Instant modifiedAt,
        String modifiedBy,
        Operation operation,
        ObjectNode fields) {

    public NormalizedRecord {
        if (recordId == null || recordId.isEmpty()) {
            throw new IllegalArgumentException("recordId must not be empty");
        }
    }
}

package com.companya.ledgersync.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Body for the ledger write API plus the statistics that travel alongside it.
 *
 * @param dataKey  top-level key of the body, e.g. {@code employeeData}
 * @param endpoint table endpoint path, e.g. {@code /employees}
 * @param body     {@code {"<dataKey>": {recordId, createdTimestamp, modifiedTimestamp, modifiedBy, allData}}}
 * @param stats    size reduction achieved by filtering
 */
public record ForwardingPayload(String dataKey, String endpoint, ObjectNode body, ReductionStats stats) {
}

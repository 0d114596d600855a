package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.DatabaseFamily;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;

/**
 * MySQL and MariaDB, with ERPNext naming conventions. ERPNext stores DATETIME(6) columns that
 * Debezium emits as epoch microseconds in server-local time.
 */
public class MySqlAdapter extends AbstractSourceAdapter {

    static final FieldDefaults DEFAULTS = new FieldDefaults("name", "creation", "modified", "modified_by");

    public MySqlAdapter(App app, Clock clock) {
        super(app, DEFAULTS, clock);
    }

    @Override
    public DatabaseFamily family() {
        return DatabaseFamily.MYSQL;
    }

    @Override
    protected Long rowEventTimestampMs(ChangeEnvelope envelope, JsonNode data) {
        Long modified = epochMillis(data.get(modifiedField()));
        return modified != null ? modified : epochMillis(data.get(createdField()));
    }

    // only sub-second encodings are precise enough for latency accounting
    private Long epochMillis(JsonNode value) {
        if (value == null || !value.isNumber() || Math.abs(value.asDouble()) <= Timestamps.MILLIS_THRESHOLD) {
            return null;
        }
        return fromNumber(value.asLong()).toEpochMilli();
    }
}

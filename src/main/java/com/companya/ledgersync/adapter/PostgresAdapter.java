package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.model.DatabaseFamily;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * PostgreSQL. TIMESTAMPTZ text keeps its zone, plain TIMESTAMP text gets the configured offset.
 */
public class PostgresAdapter extends AbstractSourceAdapter {

    static final FieldDefaults DEFAULTS = new FieldDefaults("id", "created_at", "updated_at", "updated_by");

    private static final Set<String> SYSTEM_COLUMNS = Set.of("xmin", "xmax", "cmin", "cmax", "ctid", "tableoid");

    public PostgresAdapter(App app, Clock clock) {
        super(app, DEFAULTS, clock);
    }

    @Override
    public DatabaseFamily family() {
        return DatabaseFamily.POSTGRES;
    }

    @Override
    protected Instant convert(JsonNode raw) {
        if (raw.isTextual()) {
            switch (raw.asText().trim().toLowerCase(Locale.ROOT)) {
                case "infinity", "+infinity":
                    return Timestamps.POSITIVE_INFINITY;
                case "-infinity":
                    return Timestamps.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        return super.convert(raw);
    }

    @Override
    protected boolean isSystemField(String key) {
        return SYSTEM_COLUMNS.contains(key) || key.startsWith("_");
    }

    @Override
    protected JsonNode normalizeValue(String key, JsonNode value) {
        if (value.isArray() && value.isEmpty()) {
            return null;
        }
        return value;
    }
}

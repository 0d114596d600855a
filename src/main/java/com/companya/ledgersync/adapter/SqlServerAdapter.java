package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.DatabaseFamily;
import com.companya.ledgersync.model.Operation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL Server, including the CDC capture-table columns ({@code __$operation}, {@code __$start_lsn}, ...).
 */
public class SqlServerAdapter extends AbstractSourceAdapter {

    static final FieldDefaults DEFAULTS = new FieldDefaults("id", "created_at", "updated_at", "updated_by");

    /** .NET ticks at the Unix epoch. */
    static final long EPOCH_TICKS = 621_355_968_000_000_000L;
    static final double TICKS_THRESHOLD = 1e17;

    private static final Pattern JSON_DATE = Pattern.compile("/?Date\\((-?\\d+)(?:[+-]\\d{4})?\\)/?");
    private static final Pattern MONEY = Pattern.compile("-?\\d+\\.\\d{4}");
    private static final Set<String> VERSION_COLUMNS = Set.of("rowversion", "$rowversion", "timestamp");

    public SqlServerAdapter(App app, Clock clock) {
        super(app, DEFAULTS, clock);
    }

    @Override
    public DatabaseFamily family() {
        return DatabaseFamily.SQLSERVER;
    }

    @Override
    protected Operation explicitOperation(ChangeEnvelope envelope, JsonNode data) {
        Operation fromEnvelope = super.explicitOperation(envelope, data);
        if (fromEnvelope != null || data == null || !data.hasNonNull("__$operation")) {
            return fromEnvelope;
        }
        return switch (data.get("__$operation").asInt()) {
            case 1 -> Operation.DELETE;
            case 2 -> Operation.CREATE;
            default -> Operation.UPDATE;
        };
    }

    @Override
    protected Instant convert(JsonNode raw) {
        if (raw.isTextual()) {
            Matcher matcher = JSON_DATE.matcher(raw.asText().trim());
            if (matcher.matches()) {
                return Instant.ofEpochMilli(Long.parseLong(matcher.group(1)));
            }
        }
        return super.convert(raw);
    }

    @Override
    protected Instant fromNumber(long value) {
        if (value > TICKS_THRESHOLD) {
            return Instant.ofEpochMilli((value - EPOCH_TICKS) / 10_000).minus(timezoneOffset());
        }
        return super.fromNumber(value);
    }

    @Override
    protected boolean isSystemField(String key) {
        return key.startsWith("_") || VERSION_COLUMNS.contains(key.toLowerCase(Locale.ROOT));
    }

    @Override
    protected JsonNode normalizeValue(String key, JsonNode value) {
        if (value.isTextual() && MONEY.matcher(value.asText()).matches()) {
            return JsonNodeFactory.instance.numberNode(new BigDecimal(value.asText()));
        }
        return value;
    }
}

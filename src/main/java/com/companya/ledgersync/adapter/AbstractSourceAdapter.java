package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.config.LedgerSyncProperties.Database;
import com.companya.ledgersync.config.LedgerSyncProperties.Table;
import com.companya.ledgersync.config.LedgerSyncProperties.TimestampFields;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.ForwardingPayload;
import com.companya.ledgersync.model.NormalizedRecord;
import com.companya.ledgersync.model.Operation;
import com.companya.ledgersync.model.ReductionStats;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

/**
 * Behaviour shared by every family. Subclasses override the conversion and filtering hooks.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {

    public static final String DEFAULT_MODIFIED_BY = "system";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final App app;
    protected final Clock clock;
    private final FieldDefaults defaults;
    private final Duration timezoneOffset;
    private final long operationThresholdMs;

    protected AbstractSourceAdapter(App app, FieldDefaults defaults, Clock clock) {
        this.app = app;
        this.defaults = defaults;
        this.clock = clock;
        Database database = app.getDatabase() != null ? app.getDatabase() : new Database();
        this.timezoneOffset = Duration.ofHours(database.getTimezoneOffsetHours())
                .plusMinutes(database.getTimezoneOffsetMinutes());
        this.operationThresholdMs = database.getOperationThresholdMs();
    }

    /**
     * Per-family field names used when the app does not configure its own.
     */
    public record FieldDefaults(String idField, String created, String modified, String modifiedBy) {
    }

    // ---- field names ----

    protected String idField() {
        Database database = app.getDatabase();
        if (database != null && hasText(database.getIdField())) {
            return database.getIdField();
        }
        return defaults.idField();
    }

    protected String createdField() {
        TimestampFields fields = timestampFields();
        return fields != null && hasText(fields.getCreated()) ? fields.getCreated() : defaults.created();
    }

    protected String modifiedField() {
        TimestampFields fields = timestampFields();
        return fields != null && hasText(fields.getModified()) ? fields.getModified() : defaults.modified();
    }

    protected String modifiedByField() {
        TimestampFields fields = timestampFields();
        return fields != null && hasText(fields.getModifiedBy()) ? fields.getModifiedBy() : defaults.modifiedBy();
    }

    private TimestampFields timestampFields() {
        return app.getDatabase() != null ? app.getDatabase().getTimestampFields() : null;
    }

    protected Duration timezoneOffset() {
        return timezoneOffset;
    }

    // ---- operation ----

    @Override
    public JsonNode rowImage(ChangeEnvelope envelope) {
        return envelope.rowImage();
    }

    @Override
    public Operation detectOperation(ChangeEnvelope envelope, JsonNode data) {
        Operation explicit = explicitOperation(envelope, data);
        if (explicit != null) {
            return explicit;
        }
        if (data == null) {
            return Operation.CREATE;
        }
        if (isDeletedMarker(data.get("__deleted"))) {
            return Operation.DELETE;
        }
        boolean hasCreated = !isAbsent(data.get(createdField()));
        boolean hasModified = !isAbsent(data.get(modifiedField()));
        if (hasCreated && hasModified) {
            Instant created = tryConvert(data.get(createdField()));
            Instant modified = tryConvert(data.get(modifiedField()));
            if (created == null || modified == null) {
                return Operation.CREATE;
            }
            long diff = Math.abs(Duration.between(created, modified).toMillis());
            return diff < operationThresholdMs ? Operation.CREATE : Operation.UPDATE;
        }
        if (hasCreated) {
            return Operation.READ;
        }
        return Operation.CREATE;
    }

    /**
     * Operation stated by the message itself, {@code null} when it has none.
     */
    protected Operation explicitOperation(ChangeEnvelope envelope, JsonNode data) {
        return Operation.fromCode(envelope.operationCode());
    }

    private static boolean isDeletedMarker(JsonNode marker) {
        if (marker == null) {
            return false;
        }
        return marker.isBoolean() ? marker.booleanValue() : "true".equalsIgnoreCase(marker.asText());
    }

    // ---- timestamps ----

    @Override
    public Instant normalizeTimestamp(JsonNode raw) {
        Instant converted = tryConvert(raw);
        return converted != null ? converted : clock.instant();
    }

    private Instant tryConvert(JsonNode raw) {
        if (isAbsent(raw)) {
            return null;
        }
        try {
            return convert(raw);
        } catch (RuntimeException ex) {
            log.debug("Unparseable timestamp {}: {}", raw, ex.getMessage());
            return null;
        }
    }

    /**
     * Converts a present raw value. Numbers are read by magnitude, zone-less text is shifted by the
     * configured offset.
     *
     * @return the instant, or {@code null} when the value is not a recognised encoding
     */
    protected Instant convert(JsonNode raw) {
        if (raw.isNumber()) {
            return fromNumber(raw.asLong());
        }
        if (raw.isTextual()) {
            String text = raw.asText().trim();
            if (Timestamps.isInteger(text)) {
                return fromNumber(Long.parseLong(text));
            }
            return fromText(text);
        }
        return null;
    }

    protected Instant fromNumber(long value) {
        return Timestamps.fromEpochNumber(value).minus(timezoneOffset);
    }

    protected Instant fromText(String text) {
        Timestamps.ParsedText parsed = Timestamps.parseText(text);
        if (parsed == null) {
            return null;
        }
        return parsed.zoned() ? parsed.instant() : parsed.instant().minus(timezoneOffset);
    }

    @Override
    public Instant createdTimestamp(JsonNode data) {
        return normalizeTimestamp(data.get(createdField()));
    }

    @Override
    public Instant modifiedTimestamp(JsonNode data) {
        return normalizeTimestamp(data.get(modifiedField()));
    }

    @Override
    public String modifiedBy(JsonNode data) {
        JsonNode value = data.get(modifiedByField());
        return isAbsent(value) ? DEFAULT_MODIFIED_BY : value.asText();
    }

    @Override
    public long eventTimestampMs(ChangeEnvelope envelope, JsonNode data) {
        if (envelope.sourceTsMs() != null && envelope.sourceTsMs() > 0) {
            return envelope.sourceTsMs();
        }
        if (envelope.envelopeTsMs() != null && envelope.envelopeTsMs() > 0) {
            return envelope.envelopeTsMs();
        }
        JsonNode root = envelope.root();
        if (root != null && root.path("connector_processing_time").canConvertToLong()
                && root.path("connector_processing_time").asLong() > 0) {
            return root.get("connector_processing_time").asLong();
        }
        Long fromRow = data != null ? rowEventTimestampMs(envelope, data) : null;
        return fromRow != null ? fromRow : envelope.busTimestampMs();
    }

    /**
     * Family-specific event time taken from the row or the message, {@code null} when unknown.
     */
    protected Long rowEventTimestampMs(ChangeEnvelope envelope, JsonNode data) {
        return null;
    }

    // ---- identity ----

    @Override
    public String extractRecordId(String tableName, JsonNode data, Instant receivedAt) {
        String natural = naturalId(data);
        return natural != null ? natural : tableName + "_" + receivedAt.toEpochMilli();
    }

    @Override
    public boolean hasNaturalId(JsonNode data) {
        return naturalId(data) != null;
    }

    private String naturalId(JsonNode data) {
        if (data == null) {
            return null;
        }
        String id = identityText(data.get(idField()));
        if (id == null && !idField().equals(defaults.idField())) {
            id = identityText(data.get(defaults.idField()));
        }
        return id;
    }

    /**
     * Renders an identity value as a string, {@code null} when it is absent or not a scalar.
     */
    protected String identityText(JsonNode value) {
        if (isEmptyValue(value) || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    // ---- filtering ----

    @Override
    public ObjectNode filterFields(Table table, JsonNode data) {
        ObjectNode filtered = JsonNodeFactory.instance.objectNode();
        if (data == null || !data.isObject()) {
            return filtered;
        }
        if (table != null && table.getFields() != null && !table.getFields().isEmpty()) {
            for (String field : table.getFields()) {
                putIfMeaningful(filtered, field, data.get(field));
            }
            return filtered;
        }
        Iterator<Map.Entry<String, JsonNode>> it = data.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!isSystemField(entry.getKey())) {
                putIfMeaningful(filtered, entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }

    private void putIfMeaningful(ObjectNode target, String key, JsonNode value) {
        if (isEmptyValue(value)) {
            return;
        }
        JsonNode normalized = normalizeValue(key, value);
        if (normalized != null) {
            target.set(key, normalized);
        }
    }

    /**
     * Internal columns dropped by the generic filter. Base rule: a leading underscore, except {@code _id}.
     */
    protected boolean isSystemField(String key) {
        return key.startsWith("__") || (key.startsWith("_") && !"_id".equals(key));
    }

    /**
     * Family-specific value rewriting applied to kept fields.
     *
     * @return the value to keep, or {@code null} to drop the field
     */
    protected JsonNode normalizeValue(String key, JsonNode value) {
        return value;
    }

    // ---- assembly ----

    @Override
    public NormalizedRecord normalize(ChangeEnvelope envelope, Table table, JsonNode data) {
        return new NormalizedRecord(
                extractRecordId(envelope.tableName(), data, envelope.receivedAt()),
                createdTimestamp(data),
                modifiedTimestamp(data),
                modifiedBy(data),
                detectOperation(envelope, data),
                filterFields(table, data));
    }

    @Override
    public ForwardingPayload transformForLedger(Table table, NormalizedRecord record, JsonNode raw) {
        ObjectNode inner = JsonNodeFactory.instance.objectNode();
        inner.put("recordId", record.recordId());
        inner.put("createdTimestamp", Timestamps.format(record.createdAt()));
        inner.put("modifiedTimestamp", Timestamps.format(record.modifiedAt()));
        inner.put("modifiedBy", record.modifiedBy());
        inner.set("allData", record.fields());

        String dataKey = table.effectiveDataKey();
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.set(dataKey, inner);

        int originalSize = raw != null ? raw.toString().length() : 0;
        ReductionStats stats = ReductionStats.of(originalSize, record.fields().toString().length());
        return new ForwardingPayload(dataKey, table.effectiveEndpoint(), body, stats);
    }

    // ---- helpers ----

    /**
     * Missing, JSON null, empty text or the text {@code "null"}.
     */
    protected static boolean isEmptyValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isTextual()) {
            String text = value.asText();
            return text.isEmpty() || "null".equals(text);
        }
        return false;
    }

    /**
     * An empty value, or numeric zero. Used for timestamps and actors.
     */
    protected static boolean isAbsent(JsonNode value) {
        return isEmptyValue(value) || (value.isNumber() && value.asDouble() == 0d);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

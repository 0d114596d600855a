package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.DatabaseFamily;
import com.companya.ledgersync.model.Operation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

/**
 * MongoDB, fed either by Debezium (documents as extended JSON, possibly string-encoded) or by
 * native change-stream documents ({@code operationType}, {@code fullDocument}, {@code clusterTime}).
 */
public class MongoDbAdapter extends AbstractSourceAdapter {

    static final FieldDefaults DEFAULTS = new FieldDefaults("_id", "created_at", "updated_at", "updated_by");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public MongoDbAdapter(App app, Clock clock) {
        super(app, DEFAULTS, clock);
    }

    @Override
    public DatabaseFamily family() {
        return DatabaseFamily.MONGODB;
    }

    @Override
    public JsonNode rowImage(ChangeEnvelope envelope) {
        JsonNode root = envelope.root();
        if (root != null && root.path("fullDocument").isObject()) {
            return root.get("fullDocument");
        }
        if (root != null && "delete".equals(root.path("operationType").asText())
                && root.path("documentKey").isObject()) {
            return root.get("documentKey");
        }
        return super.rowImage(envelope);
    }

    @Override
    protected Operation explicitOperation(ChangeEnvelope envelope, JsonNode data) {
        Operation fromEnvelope = super.explicitOperation(envelope, data);
        if (fromEnvelope != null) {
            return fromEnvelope;
        }
        JsonNode root = envelope.root();
        if (root == null || !root.hasNonNull("operationType")) {
            return null;
        }
        return switch (root.get("operationType").asText()) {
            case "insert" -> Operation.CREATE;
            case "delete" -> Operation.DELETE;
            default -> Operation.UPDATE;
        };
    }

    @Override
    protected Instant convert(JsonNode raw) {
        if (raw.isObject()) {
            if (raw.has("$date")) {
                JsonNode date = raw.get("$date");
                if (date.isTextual()) {
                    Timestamps.ParsedText parsed = Timestamps.parseText(date.asText());
                    return parsed != null ? parsed.instant() : null;
                }
                if (date.isNumber()) {
                    return Instant.ofEpochMilli(date.asLong());
                }
                if (date.has("$numberLong")) {
                    return Instant.ofEpochMilli(Long.parseLong(date.get("$numberLong").asText()));
                }
                return null;
            }
            if (raw.has("$numberLong")) {
                return fromNumber(Long.parseLong(raw.get("$numberLong").asText()));
            }
            if (raw.path("$timestamp").has("t")) {
                return Instant.ofEpochSecond(raw.get("$timestamp").get("t").asLong());
            }
            return null;
        }
        return super.convert(raw);
    }

    @Override
    protected Long rowEventTimestampMs(ChangeEnvelope envelope, JsonNode data) {
        JsonNode seconds = envelope.root() != null
                ? envelope.root().path("clusterTime").path("$timestamp").path("t")
                : null;
        if (seconds == null || !seconds.canConvertToLong()) {
            return null;
        }
        return seconds.asLong() * 1000;
    }

    @Override
    protected String identityText(JsonNode value) {
        if (value != null && value.isObject() && value.has("$oid")) {
            return value.get("$oid").asText();
        }
        return super.identityText(value);
    }

    @Override
    protected boolean isSystemField(String key) {
        return key.startsWith("_") && !"_id".equals(key);
    }

    @Override
    protected JsonNode normalizeValue(String key, JsonNode value) {
        try {
            return unwrap(value);
        } catch (NumberFormatException ex) {
            log.warn("Dropping field {}: malformed number ({})", key, ex.getMessage());
            return null;
        }
    }

    /**
     * Replaces extended-JSON wrappers with plain values, recursively.
     */
    JsonNode unwrap(JsonNode value) {
        if (value.isArray()) {
            ArrayNode copy = NODES.arrayNode();
            value.forEach(element -> copy.add(unwrap(element)));
            return copy;
        }
        if (!value.isObject()) {
            return value;
        }
        if (value.has("$oid")) {
            return NODES.textNode(value.get("$oid").asText());
        }
        if (value.has("$date")) {
            Instant instant = convert(value);
            return instant != null ? NODES.textNode(Timestamps.format(instant)) : NODES.nullNode();
        }
        if (value.has("$numberLong")) {
            return NODES.numberNode(Long.parseLong(value.get("$numberLong").asText()));
        }
        if (value.has("$numberInt")) {
            return NODES.numberNode(Integer.parseInt(value.get("$numberInt").asText()));
        }
        if (value.has("$numberDouble")) {
            return NODES.numberNode(Double.parseDouble(value.get("$numberDouble").asText()));
        }
        if (value.has("$numberDecimal")) {
            return NODES.numberNode(new BigDecimal(value.get("$numberDecimal").asText()));
        }
        if (value.has("$binary")) {
            JsonNode binary = value.get("$binary");
            return NODES.textNode(binary.isObject() ? binary.path("base64").asText() : binary.asText());
        }
        ObjectNode copy = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = value.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            copy.set(entry.getKey(), unwrap(entry.getValue()));
        }
        return copy;
    }
}

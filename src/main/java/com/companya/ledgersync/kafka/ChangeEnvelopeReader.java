package com.companya.ledgersync.kafka;

import com.companya.ledgersync.model.ChangeEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Reads message bodies into {@link ChangeEnvelope}s. Accepts the Debezium envelope with or without
 * the {@code schema}/{@code payload} wrapper, and bare row images from snapshot or direct delivery.
 */
@Component
@RequiredArgsConstructor
public class ChangeEnvelopeReader {

    private final ObjectMapper objectMapper;

    public ChangeEnvelope read(String topic, String value, long busTimestampMs, Instant receivedAt) {
        JsonNode root;
        try {
            root = objectMapper.readTree(value);
        } catch (JsonProcessingException ex) {
            throw new MalformedEnvelopeException("Invalid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Expected a JSON object but got "
                    + (root == null ? "nothing" : root.getNodeType()));
        }

        JsonNode payload = envelopePayload(root);
        if (payload == null) {
            return new ChangeEnvelope(topic, null, null, root, null, null, busTimestampMs, receivedAt, root);
        }
        return new ChangeEnvelope(
                topic,
                payload.hasNonNull("op") ? payload.get("op").asText() : null,
                image(payload.get("before")),
                image(payload.get("after")),
                longOrNull(payload.path("source").path("ts_ms")),
                longOrNull(payload.path("ts_ms")),
                busTimestampMs,
                receivedAt,
                root);
    }

    private static JsonNode envelopePayload(JsonNode root) {
        if (root.path("payload").isObject()) {
            return root.get("payload");
        }
        boolean unwrapped = root.has("op") && (root.has("after") || root.has("before"));
        return unwrapped ? root : null;
    }

    // the MongoDB connector emits documents as JSON strings
    private JsonNode image(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            try {
                return objectMapper.readTree(node.asText());
            } catch (JsonProcessingException ex) {
                throw new MalformedEnvelopeException("Row image is not valid JSON: " + ex.getOriginalMessage(), ex);
            }
        }
        return node;
    }

    private static Long longOrNull(JsonNode node) {
        return node.canConvertToLong() ? node.asLong() : null;
    }
}

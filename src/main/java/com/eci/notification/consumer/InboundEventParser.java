package com.eci.notification.consumer;

import com.eci.notification.error.ValidationException;
import com.eci.notification.model.Channel;
import com.eci.notification.model.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses inbound event JSON into an {@link Event}.
 *
 * <pre>{@code
 * {
 *   "event_id":    "evt-123",           // optional, see fallbackEventId
 *   "event_type":  "order.confirmed",
 *   "payload":     { "order_id": "o-1", "customer_email": "jane@example.com" },
 *   "occurred_at": "2024-05-01T10:15:30Z",  // optional
 *   "channel":     "EMAIL",              // optional routing hints
 *   "recipient":   "jane@example.com",
 *   "locale":      "fr-CA"
 * }
 * }</pre>
 *
 * {@code data} is accepted in place of {@code payload}. Scalar payload
 * values are stringified, nested objects and arrays are kept as JSON text
 * and nulls are dropped. Type and id checks are left to the engine.
 */
public class InboundEventParser {

    private final ObjectMapper mapper;

    public InboundEventParser(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param fallbackEventId id used when the message carries none
     * @throws ValidationException if the text is not a JSON object or a
     *         field has the wrong shape
     */
    public Event parse(final String json, final String fallbackEventId) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Empty message");
        }
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root, fallbackEventId);
    }

    public Event parse(final JsonNode root, final String fallbackEventId) {
        if (root == null || !root.isObject()) {
            throw new ValidationException("Event must be a JSON object");
        }

        final String eventId = text(root, "event_id");
        final Event.Builder builder = Event.builder(
                eventId != null ? eventId : fallbackEventId,
                text(root, "event_type"));

        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull()) {
            payload = root.get("data");
        }
        if (payload != null && !payload.isNull()) {
            if (!payload.isObject()) {
                throw new ValidationException("payload must be a JSON object");
            }
            builder.payload(flatten(payload));
        }

        final String occurredAt = text(root, "occurred_at");
        if (occurredAt != null) {
            try {
                builder.occurredAt(Instant.parse(occurredAt));
            } catch (DateTimeParseException e) {
                throw new ValidationException("occurred_at is not an ISO-8601 instant: " + occurredAt, e);
            }
        }

        final String channel = text(root, "channel");
        if (channel != null) {
            try {
                builder.channel(Channel.parse(channel));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage(), e);
            }
        }
        return builder
                .recipient(text(root, "recipient"))
                .locale(text(root, "locale"))
                .build();
    }

    private static Map<String, String> flatten(final JsonNode payload) {
        final Map<String, String> values = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final JsonNode value = field.getValue();
            if (value == null || value.isNull()) continue;
            values.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return values;
    }

    /** Text of a scalar field, or {@code null} when absent, null or blank. */
    private static String text(final JsonNode root, final String field) {
        final JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        final String value = node.asText();
        return value.isBlank() ? null : value.trim();
    }
}

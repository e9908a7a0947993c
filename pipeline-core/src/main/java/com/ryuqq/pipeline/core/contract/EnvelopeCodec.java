package com.ryuqq.pipeline.core.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.pipeline.core.exception.MalformedEnvelopeException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * JSON codec for the {@link EventEnvelope} wire shape.
 *
 * <p>The same shape is used on the broadcast channel and on the direct-delivery path:</p>
 * <pre>
 * {"id": "...", "type": "margin_check_request", "sourceModule": "cdo", "targetModule": "cfo",
 *  "payload": {...}, "correlationId": "...", "timestamp": "2024-01-01T00:00:00Z"}
 * </pre>
 *
 * <p>Modules are written with their wire names; on read both wire names and enum names are
 * accepted. Timestamps are ISO-8601 strings; a timestamp without offset is taken as UTC.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnvelopeCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(defaultMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Creates the mapper used when none is supplied.
     *
     * @return mapper with {@link JavaTimeModule} and ISO-8601 dates
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Encodes an envelope to its wire JSON.
     *
     * @param envelope envelope to encode
     * @return JSON string
     * @throws MalformedEnvelopeException if the payload holds values Jackson cannot write
     */
    public String encode(EventEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        ObjectNode node = mapper.createObjectNode();
        node.put("id", envelope.id());
        node.put("type", envelope.type());
        node.put("sourceModule", envelope.sourceModule().wireName());
        if (envelope.targetModule() == null) {
            node.putNull("targetModule");
        } else {
            node.put("targetModule", envelope.targetModule().wireName());
        }
        node.set("payload", mapper.valueToTree(envelope.payload()));
        if (envelope.correlationId() == null) {
            node.putNull("correlationId");
        } else {
            node.put("correlationId", envelope.correlationId());
        }
        node.put("timestamp", envelope.timestamp().toString());
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Failed to encode envelope: " + envelope.id(), e);
        }
    }

    /**
     * Decodes wire JSON into an envelope.
     *
     * @param json wire JSON
     * @return decoded envelope
     * @throws MalformedEnvelopeException if the input is not valid JSON, lacks a required field,
     *         names an unknown module or carries an unparseable timestamp
     */
    public EventEnvelope decode(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedEnvelopeException("Envelope JSON is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Envelope is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Envelope must be a JSON object");
        }

        String id = requiredText(root, "id");
        String type = requiredText(root, "type");
        ModuleName source = module(requiredText(root, "sourceModule"), "sourceModule");
        String targetText = optionalText(root, "targetModule");
        ModuleName target = targetText == null ? null : module(targetText, "targetModule");
        String correlationId = optionalText(root, "correlationId");
        Instant timestamp = timestamp(requiredText(root, "timestamp"));

        Map<String, Object> payload;
        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || payloadNode.isNull()) {
            payload = Map.of();
        } else if (payloadNode.isObject()) {
            payload = mapper.convertValue(payloadNode, PAYLOAD_TYPE);
        } else {
            throw new MalformedEnvelopeException("payload must be a JSON object (id: " + id + ")");
        }

        try {
            return new EventEnvelope(id, type, source, target, payload, correlationId, timestamp);
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Invalid envelope: " + e.getMessage(), e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        String value = optionalText(root, field);
        if (value == null || value.isBlank()) {
            throw new MalformedEnvelopeException("Missing required field: " + field);
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new MalformedEnvelopeException("Field must be a scalar: " + field);
        }
        return node.asText();
    }

    private static ModuleName module(String value, String field) {
        try {
            return ModuleName.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Unknown module in " + field + ": " + value, e);
        }
    }

    private static Instant timestamp(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            // zone-less local timestamps are read as UTC
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                throw new MalformedEnvelopeException("timestamp is not ISO-8601: " + value, e);
            }
        }
    }
}

package com.aegis.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON interchange for the engine: raw input in, reports and records out.
 *
 * <p>Raw input is read into plain maps, lists, strings, numbers and booleans, which is exactly
 * what the coercion layer accepts. Reports are written with violations in report order.
 * The {@code JavaTimeModule} writes timestamps as ISO-8601 text.
 */
public final class ValidationJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> RAW_INPUT = new TypeReference<>() {};

    private ValidationJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Parses a JSON object into raw input. Nested objects become maps and arrays become lists.
     *
     * @throws ValidationJsonException if the text is malformed or not a JSON object
     */
    public static Map<String, Object> readRawInput(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new ValidationJsonException("Malformed raw input JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ValidationJsonException("Raw input must be a JSON object", null);
        }
        return MAPPER.convertValue(node, RAW_INPUT);
    }

    /**
     * Renders a report as {@code {"violations":[{"path":..,"kind":..,"message":..,"context":{..}}]}}.
     */
    public static String writeReport(ValidationErrorReport report) {
        return write(reportNode(report));
    }

    /** Renders a validated record as a JSON object of its typed fields. */
    public static String writeRecord(ValidatedRecord record) {
        return write(MAPPER.valueToTree(plain(record)));
    }

    /** Renders either outcome, tagged with the record kind and {@code valid}. */
    public static String writeResult(ValidationResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("recordKind", result.recordKind());
        root.put("valid", result.valid());
        if (result.valid()) {
            root.set("record", MAPPER.valueToTree(plain(result.record())));
        } else {
            root.set("violations", reportNode(result.errors()).get("violations"));
        }
        return write(root);
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static ObjectNode reportNode(ValidationErrorReport report) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode violations = root.putArray("violations");
        for (Violation violation : report.violations()) {
            ObjectNode node = violations.addObject();
            node.put("path", violation.path().toString());
            node.put("kind", violation.kind().code());
            node.put("message", violation.message());
            try {
                node.set("context", MAPPER.valueToTree(plainMap(violation.context())));
            } catch (IllegalArgumentException e) {
                throw new ValidationJsonException("Violation context is not serializable: " + violation, e);
            }
        }
        return root;
    }

    private static Object plain(Object value) {
        if (value instanceof ValidatedRecord record) {
            return plainMap(record.asMap());
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(plain(item)));
            return copy;
        }
        if (value instanceof Tagged tagged) {
            return tagged.tag();
        }
        return value;
    }

    private static Map<String, Object> plainMap(Map<String, Object> values) {
        var copy = new LinkedHashMap<String, Object>();
        values.forEach((key, value) -> copy.put(key, plain(value)));
        return copy;
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ValidationJsonException("Failed to write JSON", e);
        }
    }

    /**
     * Exception thrown when raw input cannot be read or a result cannot be written.
     */
    public static class ValidationJsonException extends RuntimeException {
        public ValidationJsonException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

package com.aegis.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One failed constraint or business rule.
 *
 * @param path where the failure was found ({@link FieldPath#root()} for record-level rules)
 * @param kind machine-readable kind
 * @param message human-readable message
 * @param context the data the message was rendered from (offending value, bounds, rule name),
 *     in insertion order
 */
public record Violation(FieldPath path, ViolationKind kind, String message, Map<String, Object> context) {

    public Violation {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Violation(FieldPath path, ViolationKind kind, String message) {
        this(path, kind, message, Map.of());
    }

    /** Returns the same violation re-rooted under {@code parent}. */
    public Violation under(FieldPath parent) {
        return new Violation(parent.resolve(path), kind, message, context);
    }

    @Override
    public String toString() {
        String where = path.isRoot() ? "(record)" : path.toString();
        return where + " [" + kind.code() + "]: " + message;
    }
}

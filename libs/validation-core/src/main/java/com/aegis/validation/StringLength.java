package com.aegis.validation;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Inclusive length range for strings. Length is counted in Unicode code points, so a character
 * outside the BMP counts once.
 *
 * @param min inclusive minimum length, {@code >= 0}
 * @param max inclusive maximum length, {@code >= min}
 */
public record StringLength(int min, int max) implements Constraint {

    public static final String TAG = "string-length";

    public StringLength {
        if (min < 0) {
            throw new IllegalArgumentException("min must be >= 0");
        }
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min, got " + max + " < " + min);
        }
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public ViolationKind kind() {
        return ViolationKind.LENGTH_ERROR;
    }

    @Override
    public boolean appliesTo(SemanticType type) {
        return type == SemanticType.STRING;
    }

    @Override
    public Optional<Violation> check(FieldPath path, Object value) {
        String text = (String) value;
        int length = text.codePointCount(0, text.length());
        if (length < min) {
            return Optional.of(violation(path, length, "min", min,
                    "String should have at least %d character%s".formatted(min, min == 1 ? "" : "s")));
        }
        if (length > max) {
            return Optional.of(violation(path, length, "max", max,
                    "String should have at most %d character%s".formatted(max, max == 1 ? "" : "s")));
        }
        return Optional.empty();
    }

    private Violation violation(FieldPath path, int length, String boundName, int bound, String message) {
        var context = new LinkedHashMap<String, Object>();
        context.put("constraint", TAG);
        context.put("length", length);
        context.put(boundName, bound);
        return new Violation(path, kind(), message, context);
    }
}

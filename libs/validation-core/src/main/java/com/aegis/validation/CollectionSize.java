package com.aegis.validation;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Inclusive element-count range for collection fields.
 *
 * @param min inclusive minimum count, {@code >= 0}
 * @param max inclusive maximum count, {@code >= min}
 */
public record CollectionSize(int min, int max) implements Constraint {

    public static final String TAG = "collection-size";

    public CollectionSize {
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
        return ViolationKind.SIZE_ERROR;
    }

    @Override
    public boolean appliesTo(SemanticType type) {
        return type == SemanticType.COLLECTION_OF_RECORD;
    }

    @Override
    public Optional<Violation> check(FieldPath path, Object value) {
        int count = ((Collection<?>) value).size();
        if (count < min) {
            return Optional.of(violation(path, count, "min", min,
                    "List should have at least %d item%s".formatted(min, min == 1 ? "" : "s")));
        }
        if (count > max) {
            return Optional.of(violation(path, count, "max", max,
                    "List should have at most %d item%s".formatted(max, max == 1 ? "" : "s")));
        }
        return Optional.empty();
    }

    private Violation violation(FieldPath path, int count, String boundName, int bound, String message) {
        var context = new LinkedHashMap<String, Object>();
        context.put("constraint", TAG);
        context.put("count", count);
        context.put(boundName, bound);
        return new Violation(path, kind(), message, context);
    }
}

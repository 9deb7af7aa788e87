package com.aegis.validation;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Inclusive numeric range. Either bound may be {@code null} for a one-sided range.
 *
 * @param min inclusive lower bound, or null
 * @param max inclusive upper bound, or null
 */
public record NumericRange(Number min, Number max) implements Constraint {

    public static final String TAG = "numeric-range";

    public NumericRange {
        if (min == null && max == null) {
            throw new IllegalArgumentException("at least one of min or max must be set");
        }
        if (min != null && max != null && min.doubleValue() > max.doubleValue()) {
            throw new IllegalArgumentException("min must be <= max, got " + min + " > " + max);
        }
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public ViolationKind kind() {
        return ViolationKind.RANGE_ERROR;
    }

    @Override
    public boolean appliesTo(SemanticType type) {
        return type == SemanticType.INTEGER || type == SemanticType.FLOAT;
    }

    @Override
    public Optional<Violation> check(FieldPath path, Object value) {
        double actual = ((Number) value).doubleValue();
        // NaN fails both comparisons and is reported against the lower bound
        if (min != null && !(actual >= min.doubleValue())) {
            return Optional.of(violation(path, value, "min", min,
                    "Input should be greater than or equal to " + min));
        }
        if (max != null && !(actual <= max.doubleValue())) {
            return Optional.of(violation(path, value, "max", max,
                    "Input should be less than or equal to " + max));
        }
        return Optional.empty();
    }

    private Violation violation(FieldPath path, Object value, String boundName, Number bound, String message) {
        var context = new LinkedHashMap<String, Object>();
        context.put("constraint", TAG);
        context.put("value", value);
        context.put(boundName, bound);
        return new Violation(path, kind(), message, context);
    }
}

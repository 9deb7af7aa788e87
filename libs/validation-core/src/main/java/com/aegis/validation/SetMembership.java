package com.aegis.validation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Value must be one of a fixed, ordered set of tags.
 *
 * @param allowed the allowed tags, in the order they are listed in messages
 */
public record SetMembership(List<String> allowed) implements Constraint {

    public static final String TAG = "set-membership";

    public SetMembership {
        if (allowed == null || allowed.isEmpty()) {
            throw new IllegalArgumentException("allowed must contain at least one tag");
        }
        allowed = List.copyOf(allowed);
        if (allowed.stream().distinct().count() != allowed.size()) {
            throw new IllegalArgumentException("allowed tags must be unique: " + allowed);
        }
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public ViolationKind kind() {
        return ViolationKind.ENUM_ERROR;
    }

    @Override
    public boolean appliesTo(SemanticType type) {
        return type == SemanticType.ENUM_TAG || type == SemanticType.STRING;
    }

    @Override
    public Optional<Violation> check(FieldPath path, Object value) {
        if (allowed.contains(value)) {
            return Optional.empty();
        }
        var context = new LinkedHashMap<String, Object>();
        context.put("constraint", TAG);
        context.put("value", value);
        context.put("allowed", allowed);
        return Optional.of(new Violation(path, kind(), "Input should be " + describeAllowed(), context));
    }

    /** Renders the set as {@code 'a', 'b' or 'c'}. */
    String describeAllowed() {
        List<String> quoted = allowed.stream().map(t -> "'" + t + "'").toList();
        if (quoted.size() == 1) {
            return quoted.get(0);
        }
        return quoted.subList(0, quoted.size() - 1).stream().collect(Collectors.joining(", "))
                + " or " + quoted.get(quoted.size() - 1);
    }
}

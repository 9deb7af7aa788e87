package com.aegis.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, non-empty list of violations produced by one validation run.
 *
 * <p>The order is the order in which violations were produced: schema field order for the field
 * phase, with nested violations at the position of their parent field. Renderers iterate
 * {@link #violations()} as-is.
 *
 * @param violations the violations, never empty
 */
public record ValidationErrorReport(List<Violation> violations) {

    public ValidationErrorReport {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations must contain at least one violation");
        }
        violations = List.copyOf(violations);
    }

    /** Creates a report holding exactly one violation. */
    public static ValidationErrorReport of(Violation violation) {
        return new ValidationErrorReport(List.of(violation));
    }

    public int size() {
        return violations.size();
    }

    /** Returns the violations whose rendered path equals {@code path}. */
    public List<Violation> at(String path) {
        return violations.stream()
                .filter(v -> v.path().toString().equals(path))
                .toList();
    }

    /** Returns true if any violation has the given kind. */
    public boolean contains(ViolationKind kind) {
        return violations.stream().anyMatch(v -> v.kind() == kind);
    }

    /** One line per violation, in report order. */
    public String render() {
        return violations.stream().map(Violation::toString).collect(Collectors.joining(System.lineSeparator()));
    }

    @Override
    public String toString() {
        return violations.size() + " violation(s): " + violations;
    }
}

package com.aegis.validation;

import java.util.List;
import java.util.Optional;

/**
 * A reusable, stateless check attached to a field.
 *
 * <p>Constraints receive values that are already coerced to the field's {@link SemanticType}, so
 * they never deal with type mismatches; the field validator reports those as
 * {@link ViolationKind#TYPE_ERROR} before any constraint runs. Evaluating constraints in any order
 * gives the same set of violations.
 *
 * <p>The "required" primitive is not a {@code Constraint}: it is the optionality flag of a
 * {@link FieldDeclaration}.
 */
public interface Constraint {

    /** The predicate tag, e.g. {@code "numeric-range"}. */
    String tag();

    /** The kind reported when this constraint fails. */
    ViolationKind kind();

    /** Whether this constraint can be attached to a field of the given type. */
    boolean appliesTo(SemanticType type);

    /**
     * Checks a coerced value.
     *
     * @param path the path to report on failure
     * @param value the coerced value, never null
     * @return a violation, or empty when satisfied
     */
    Optional<Violation> check(FieldPath path, Object value);

    // ── Factories ──

    /** Inclusive numeric range {@code min <= value <= max}. */
    static NumericRange range(Number min, Number max) {
        return new NumericRange(min, max);
    }

    /** Inclusive lower bound only. */
    static NumericRange atLeast(Number min) {
        return new NumericRange(min, null);
    }

    /** Inclusive upper bound only. */
    static NumericRange atMost(Number max) {
        return new NumericRange(null, max);
    }

    /** Inclusive string length range, counted in characters (code points). */
    static StringLength length(int min, int max) {
        return new StringLength(min, max);
    }

    /** Membership in a fixed set of tags. */
    static SetMembership oneOf(List<String> allowed) {
        return new SetMembership(allowed);
    }

    /** Inclusive element-count range for collections. */
    static CollectionSize size(int min, int max) {
        return new CollectionSize(min, max);
    }
}

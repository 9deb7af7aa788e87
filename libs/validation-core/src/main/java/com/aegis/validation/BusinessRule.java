package com.aegis.validation;

/**
 * A named whole-record invariant, evaluated only on records whose fields all passed.
 *
 * <p>Rules are declared per record kind as enum constants implementing this interface and are
 * stored, in order, on the {@link RecordSchema}. {@link BusinessRuleValidator} runs them in that
 * order and stops at the first one that does not hold.
 */
public interface BusinessRule {

    /** Stable rule identifier, reported in the violation context. */
    String name();

    /** The message reported when the rule does not hold. */
    String message();

    /**
     * Evaluates the rule.
     *
     * @param fields the typed, field-valid values of the record; nested records are already
     *     fully validated
     * @return true if the rule holds
     */
    boolean isSatisfiedBy(TypedFields fields);
}

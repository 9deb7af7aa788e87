package com.aegis.validation;

import java.util.LinkedHashMap;

/**
 * Second phase of the pipeline: runs a record kind's business rules over field-valid values.
 *
 * <p>Rules run in declaration order and the phase stops at the first rule that does not hold,
 * so a failed result carries exactly one {@link ViolationKind#BUSINESS_RULE_ERROR}. This is the
 * only place a {@link ValidatedRecord} is created.
 */
public final class BusinessRuleValidator {

    /**
     * Evaluates the schema's rules.
     *
     * @param schema the schema of the record
     * @param fields the output of a successful field phase for the same kind
     * @return ok with the validated record, or a single-violation failure
     */
    public ValidationResult validateRules(RecordSchema schema, TypedFields fields) {
        if (!schema.kind().equals(fields.recordKind())) {
            throw new IllegalArgumentException(
                    "fields of '%s' cannot be checked against schema '%s'".formatted(fields.recordKind(), schema.kind()));
        }
        for (BusinessRule rule : schema.rules()) {
            if (!rule.isSatisfiedBy(fields)) {
                var context = new LinkedHashMap<String, Object>();
                context.put("rule", rule.name());
                Violation violation = new Violation(
                        FieldPath.root(), ViolationKind.BUSINESS_RULE_ERROR, rule.message(), context);
                return ValidationResult.fail(schema.kind(), ValidationErrorReport.of(violation));
            }
        }
        return ValidationResult.ok(new ValidatedRecord(fields));
    }
}

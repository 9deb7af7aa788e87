package com.aegis.validation;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating one raw input: either a {@link ValidatedRecord} or a non-empty
 * {@link ValidationErrorReport}, never both and never neither.
 *
 * @param recordKind the kind that was validated
 * @param valid true if the record passed both phases
 * @param record the validated record (null when invalid)
 * @param errors the error report (null when valid)
 */
public record ValidationResult(
        String recordKind, boolean valid, ValidatedRecord record, ValidationErrorReport errors) {

    public ValidationResult {
        if (recordKind == null || recordKind.isBlank()) {
            throw new IllegalArgumentException("recordKind must not be null or blank");
        }
        if (valid && (record == null || errors != null)) {
            throw new IllegalArgumentException("a valid result carries a record and no errors");
        }
        if (!valid && (errors == null || record != null)) {
            throw new IllegalArgumentException("an invalid result carries errors and no record");
        }
    }

    /** Creates a successful result. */
    public static ValidationResult ok(ValidatedRecord record) {
        return new ValidationResult(record.kind(), true, record, null);
    }

    /** Creates a failed result. */
    public static ValidationResult fail(String recordKind, ValidationErrorReport errors) {
        return new ValidationResult(recordKind, false, null, errors);
    }

    /** Creates a failed result from a non-empty list of violations. */
    public static ValidationResult fail(String recordKind, List<Violation> violations) {
        return fail(recordKind, new ValidationErrorReport(violations));
    }

    public Optional<ValidatedRecord> asRecord() {
        return Optional.ofNullable(record);
    }

    public Optional<ValidationErrorReport> asErrors() {
        return Optional.ofNullable(errors);
    }

    /** Violations of a failed result; empty for a valid one. */
    public List<Violation> violations() {
        return valid ? List.of() : errors.violations();
    }

    /**
     * Returns the record or throws.
     *
     * @throws RecordValidationException carrying the report when invalid
     */
    public ValidatedRecord orElseThrow() {
        if (!valid) {
            throw new RecordValidationException(recordKind, errors);
        }
        return record;
    }
}

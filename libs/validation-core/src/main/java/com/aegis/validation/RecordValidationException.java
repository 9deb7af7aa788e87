package com.aegis.validation;

/**
 * Thrown by {@link ValidationResult#orElseThrow()} for callers that prefer an exception over
 * inspecting the result.
 */
public class RecordValidationException extends RuntimeException {

    private final String recordKind;
    private final ValidationErrorReport report;

    public RecordValidationException(String recordKind, ValidationErrorReport report) {
        super("%s failed validation with %d violation(s): %s"
                .formatted(recordKind, report.size(), report.violations().get(0)));
        this.recordKind = recordKind;
        this.report = report;
    }

    public String recordKind() {
        return recordKind;
    }

    public ValidationErrorReport report() {
        return report;
    }
}

package com.aegis.validation;

/**
 * Thrown when a record kind is looked up or validated without having been defined.
 *
 * <p>This is a caller error, raised before any field of the input is looked at.
 */
public class UnknownRecordKindException extends RuntimeException {

    private final String recordKind;

    public UnknownRecordKindException(String recordKind) {
        super("Unknown record kind '%s'".formatted(recordKind));
        this.recordKind = recordKind;
    }

    public String recordKind() {
        return recordKind;
    }
}

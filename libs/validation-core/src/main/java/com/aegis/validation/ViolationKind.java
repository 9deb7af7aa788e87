package com.aegis.validation;

import java.util.Optional;

/**
 * The closed set of violation kinds a validation run can report.
 *
 * <p>The first five are field-level and are collected exhaustively. {@link #BUSINESS_RULE_ERROR}
 * is record-level and at most one is reported per record.
 */
public enum ViolationKind {
    TYPE_ERROR("type_error"),
    RANGE_ERROR("range_error"),
    LENGTH_ERROR("length_error"),
    ENUM_ERROR("enum_error"),
    SIZE_ERROR("size_error"),
    BUSINESS_RULE_ERROR("business_rule_error");

    private final String code;

    ViolationKind(String code) {
        this.code = code;
    }

    /** The machine-readable code (e.g. "range_error"). */
    public String code() {
        return code;
    }

    /** Whether violations of this kind come from the field phase. */
    public boolean isFieldLevel() {
        return this != BUSINESS_RULE_ERROR;
    }

    /**
     * Looks up a kind by its machine-readable code.
     *
     * @param code the code to match (e.g. "enum_error")
     * @return the matching kind, or empty if not found
     */
    public static Optional<ViolationKind> fromCode(String code) {
        for (ViolationKind kind : values()) {
            if (kind.code.equals(code)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

package com.aegis.validation;

/**
 * Semantic types a field can be declared with.
 *
 * <p>Each raw value is coerced to the Java type listed here before any constraint runs:
 *
 * <ul>
 *   <li>{@link #STRING} → {@link String}
 *   <li>{@link #INTEGER} → {@link Long}
 *   <li>{@link #FLOAT} → {@link Double}
 *   <li>{@link #BOOLEAN} → {@link Boolean}
 *   <li>{@link #TIMESTAMP} → {@link java.time.OffsetDateTime} in UTC
 *   <li>{@link #ENUM_TAG} → the declared enum constant
 *   <li>{@link #NESTED_RECORD} → {@link ValidatedRecord}
 *   <li>{@link #COLLECTION_OF_RECORD} → {@code List<ValidatedRecord>}
 * </ul>
 */
public enum SemanticType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    TIMESTAMP("timestamp"),
    ENUM_TAG("enum-tag"),
    NESTED_RECORD("nested-record"),
    COLLECTION_OF_RECORD("collection-of-record");

    private final String value;

    SemanticType(String value) {
        this.value = value;
    }

    /** The canonical name used in messages and JSON (e.g. "enum-tag"). */
    public String value() {
        return value;
    }

    /** True for the two types whose values are validated by a nested pipeline run. */
    public boolean isRecordValued() {
        return this == NESTED_RECORD || this == COLLECTION_OF_RECORD;
    }
}

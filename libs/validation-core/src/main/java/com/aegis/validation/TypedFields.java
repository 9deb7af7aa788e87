package com.aegis.validation;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable field values of one record after successful coercion and constraint checking.
 *
 * <p>Values use the Java types listed on {@link SemanticType}. Optional fields that were absent
 * and have no default are present with a {@code null} value. Only the field validator creates
 * instances; business rules read them.
 */
public final class TypedFields {

    private final String recordKind;
    private final Map<String, Object> values;

    TypedFields(String recordKind, Map<String, Object> values) {
        this.recordKind = recordKind;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String recordKind() {
        return recordKind;
    }

    /** Whether the schema declares this field. */
    public boolean has(String name) {
        return values.containsKey(name);
    }

    /** Whether the field is declared and holds a non-null value. */
    public boolean isPresent(String name) {
        return values.get(name) != null;
    }

    /**
     * Returns the raw typed value of a field, or null for an absent optional field.
     *
     * @throws IllegalArgumentException if the schema does not declare the field
     */
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("'%s' has no field '%s'".formatted(recordKind, name));
        }
        return values.get(name);
    }

    /** Returns the field value cast to {@code type}, or empty when absent. */
    public <T> Optional<T> find(String name, Class<T> type) {
        return Optional.ofNullable(get(name)).map(type::cast);
    }

    public String getString(String name) {
        return (String) get(name);
    }

    public Long getLong(String name) {
        return (Long) get(name);
    }

    /** INTEGER field narrowed to int; fails if the value does not fit. */
    public int getInt(String name) {
        return Math.toIntExact(required(name, Long.class));
    }

    public Double getDouble(String name) {
        return (Double) get(name);
    }

    public Boolean getBoolean(String name) {
        return (Boolean) get(name);
    }

    public OffsetDateTime getTimestamp(String name) {
        return (OffsetDateTime) get(name);
    }

    public <E extends Enum<E>> E getEnum(String name, Class<E> type) {
        return type.cast(get(name));
    }

    public ValidatedRecord getRecord(String name) {
        return (ValidatedRecord) get(name);
    }

    @SuppressWarnings("unchecked")
    public List<ValidatedRecord> getRecords(String name) {
        return (List<ValidatedRecord>) get(name);
    }

    /** Read-only view of all values in schema order. */
    public Map<String, Object> asMap() {
        return values;
    }

    private <T> T required(String name, Class<T> type) {
        Object value = get(name);
        if (value == null) {
            throw new IllegalStateException("'%s' field '%s' is absent".formatted(recordKind, name));
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypedFields other)) {
            return false;
        }
        return recordKind.equals(other.recordKind) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * recordKind.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return recordKind + values;
    }
}

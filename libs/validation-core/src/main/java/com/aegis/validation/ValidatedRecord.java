package com.aegis.validation;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A record that satisfied every field constraint and every business rule of its kind.
 *
 * <p>Immutable and constructible only by {@link BusinessRuleValidator} on its success path, so
 * holding one is proof that the record was valid when it was created. Consumers read it through
 * the accessors below; a changed record needs a new validation run.
 */
public final class ValidatedRecord {

    private final TypedFields fields;

    ValidatedRecord(TypedFields fields) {
        this.fields = fields;
    }

    public String kind() {
        return fields.recordKind();
    }

    public TypedFields fields() {
        return fields;
    }

    public boolean isPresent(String name) {
        return fields.isPresent(name);
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public <T> Optional<T> find(String name, Class<T> type) {
        return fields.find(name, type);
    }

    public String getString(String name) {
        return fields.getString(name);
    }

    public Long getLong(String name) {
        return fields.getLong(name);
    }

    public int getInt(String name) {
        return fields.getInt(name);
    }

    public Double getDouble(String name) {
        return fields.getDouble(name);
    }

    public Boolean getBoolean(String name) {
        return fields.getBoolean(name);
    }

    public OffsetDateTime getTimestamp(String name) {
        return fields.getTimestamp(name);
    }

    public <E extends Enum<E>> E getEnum(String name, Class<E> type) {
        return fields.getEnum(name, type);
    }

    public ValidatedRecord getRecord(String name) {
        return fields.getRecord(name);
    }

    public List<ValidatedRecord> getRecords(String name) {
        return fields.getRecords(name);
    }

    public Map<String, Object> asMap() {
        return fields.asMap();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ValidatedRecord other && fields.equals(other.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ValidatedRecord[" + fields + "]";
    }
}

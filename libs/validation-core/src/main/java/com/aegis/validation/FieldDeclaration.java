package com.aegis.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Schema metadata for one record attribute: name, semantic type, optionality and constraints.
 *
 * <p>Declarations are immutable; the fluent methods ({@link #length(int, int)},
 * {@link #asOptional()}, ...) return new instances:
 *
 * <pre>{@code
 * FieldDeclaration.string("station_id").length(3, 10)
 * FieldDeclaration.bool("is_operational").withDefault(true)
 * FieldDeclaration.records("crew", "crew_member").size(1, 12)
 * }</pre>
 *
 * @param name field name, unique within its schema
 * @param type semantic type raw values are coerced to
 * @param optional whether the field may be absent
 * @param defaultValue typed value used when an optional field is absent (may be null)
 * @param constraints constraints, evaluated in this order
 * @param recordKind record kind of nested elements; set only for record-valued types
 * @param enumType backing enum; set only for {@link SemanticType#ENUM_TAG}
 */
public record FieldDeclaration(
        String name,
        SemanticType type,
        boolean optional,
        Object defaultValue,
        List<Constraint> constraints,
        String recordKind,
        Class<? extends Enum<?>> enumType) {

    public FieldDeclaration {
        if (name == null || name.isBlank()) {
            throw new SchemaDefinitionException("field name must not be null or blank");
        }
        if (type == null) {
            throw new SchemaDefinitionException("field '" + name + "' must declare a type");
        }
        if (type.isRecordValued() != (recordKind != null)) {
            throw new SchemaDefinitionException(
                    "field '" + name + "': a record kind is required for, and only for, record-valued types");
        }
        if ((type == SemanticType.ENUM_TAG) != (enumType != null)) {
            throw new SchemaDefinitionException(
                    "field '" + name + "': an enum type is required for, and only for, enum-tag fields");
        }
        if (!optional && defaultValue != null) {
            throw new SchemaDefinitionException("field '" + name + "': only optional fields can have a default");
        }
        constraints = List.copyOf(constraints);
        for (Constraint constraint : constraints) {
            if (!constraint.appliesTo(type)) {
                throw new SchemaDefinitionException(
                        "field '%s': constraint %s does not apply to type %s"
                                .formatted(name, constraint.tag(), type.value()));
            }
        }
    }

    // ── Factories ──

    public static FieldDeclaration string(String name) {
        return of(name, SemanticType.STRING);
    }

    public static FieldDeclaration integer(String name) {
        return of(name, SemanticType.INTEGER);
    }

    public static FieldDeclaration number(String name) {
        return of(name, SemanticType.FLOAT);
    }

    public static FieldDeclaration bool(String name) {
        return of(name, SemanticType.BOOLEAN);
    }

    public static FieldDeclaration timestamp(String name) {
        return of(name, SemanticType.TIMESTAMP);
    }

    /**
     * Declares an enum-tag field. A {@link SetMembership} over every tag of {@code enumType} is
     * attached automatically.
     */
    public static <E extends Enum<E> & Tagged> FieldDeclaration enumTag(String name, Class<E> enumType) {
        List<String> tags = Arrays.stream(enumType.getEnumConstants()).map(Tagged::tag).toList();
        return new FieldDeclaration(
                name, SemanticType.ENUM_TAG, false, null, List.of(new SetMembership(tags)), null, enumType);
    }

    /** Declares a field holding one embedded record of another kind. */
    public static FieldDeclaration record(String name, String recordKind) {
        return new FieldDeclaration(name, SemanticType.NESTED_RECORD, false, null, List.of(), recordKind, null);
    }

    /** Declares a field holding a collection of embedded records of another kind. */
    public static FieldDeclaration records(String name, String recordKind) {
        return new FieldDeclaration(
                name, SemanticType.COLLECTION_OF_RECORD, false, null, List.of(), recordKind, null);
    }

    private static FieldDeclaration of(String name, SemanticType type) {
        return new FieldDeclaration(name, type, false, null, List.of(), null, null);
    }

    // ── Fluent copies ──

    /** Marks the field optional with no default. */
    public FieldDeclaration asOptional() {
        return new FieldDeclaration(name, type, true, null, constraints, recordKind, enumType);
    }

    /** Marks the field optional; {@code value} (already typed) is used when it is absent. */
    public FieldDeclaration withDefault(Object value) {
        return new FieldDeclaration(name, type, true, value, constraints, recordKind, enumType);
    }

    /** Appends a constraint. */
    public FieldDeclaration constrainedBy(Constraint constraint) {
        var joined = new ArrayList<>(constraints);
        joined.add(constraint);
        return new FieldDeclaration(name, type, optional, defaultValue, joined, recordKind, enumType);
    }

    public FieldDeclaration range(Number min, Number max) {
        return constrainedBy(Constraint.range(min, max));
    }

    public FieldDeclaration length(int min, int max) {
        return constrainedBy(Constraint.length(min, max));
    }

    public FieldDeclaration size(int min, int max) {
        return constrainedBy(Constraint.size(min, max));
    }

    // ── Queries ──

    public boolean required() {
        return !optional;
    }

    /** Returns the nested record kind for record-valued fields. */
    public Optional<String> nestedKind() {
        return Optional.ofNullable(recordKind);
    }
}

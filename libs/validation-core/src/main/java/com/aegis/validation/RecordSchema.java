package com.aegis.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered field declarations and business rules for one record kind.
 *
 * <p>Instances are immutable and built with {@link #builder(String)}. Field names are unique.
 */
public final class RecordSchema {

    private final String kind;
    private final List<FieldDeclaration> fields;
    private final Map<String, FieldDeclaration> fieldsByName;
    private final List<BusinessRule> rules;

    private RecordSchema(String kind, List<FieldDeclaration> fields, List<BusinessRule> rules) {
        this.kind = kind;
        this.fields = List.copyOf(fields);
        var byName = new LinkedHashMap<String, FieldDeclaration>();
        for (FieldDeclaration field : fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new SchemaDefinitionException(
                        "duplicate field '%s' in schema '%s'".formatted(field.name(), kind));
            }
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.rules = List.copyOf(rules);
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public String kind() {
        return kind;
    }

    /** Field declarations in declaration order. */
    public List<FieldDeclaration> fields() {
        return fields;
    }

    public Optional<FieldDeclaration> field(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    /** Business rules in evaluation order. */
    public List<BusinessRule> rules() {
        return rules;
    }

    @Override
    public String toString() {
        return "RecordSchema[" + kind + ", fields=" + fieldsByName.keySet() + ", rules=" + rules.size() + "]";
    }

    /** Collects fields and rules in order; {@link #build()} freezes them. */
    public static final class Builder {

        private final String kind;
        private final List<FieldDeclaration> fields = new ArrayList<>();
        private final List<BusinessRule> rules = new ArrayList<>();

        private Builder(String kind) {
            if (kind == null || kind.isBlank()) {
                throw new SchemaDefinitionException("record kind must not be null or blank");
            }
            this.kind = kind;
        }

        public Builder field(FieldDeclaration field) {
            if (field == null) {
                throw new SchemaDefinitionException("field must not be null");
            }
            fields.add(field);
            return this;
        }

        public Builder rule(BusinessRule rule) {
            if (rule == null) {
                throw new SchemaDefinitionException("rule must not be null");
            }
            rules.add(rule);
            return this;
        }

        /** Appends rules in the given order, typically {@code SomeRule.values()}. */
        public Builder rules(BusinessRule... ordered) {
            for (BusinessRule rule : ordered) {
                rule(rule);
            }
            return this;
        }

        public RecordSchema build() {
            if (fields.isEmpty()) {
                throw new SchemaDefinitionException("schema '" + kind + "' must declare at least one field");
            }
            return new RecordSchema(kind, fields, rules);
        }
    }
}

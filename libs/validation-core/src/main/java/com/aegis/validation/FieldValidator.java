package com.aegis.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * First phase of the pipeline: coerces and checks every declared field of one raw input.
 *
 * <p>The phase is exhaustive. Every field is coerced and every constraint of every field is
 * evaluated, so one report lists every field problem. A field whose raw value cannot be coerced
 * gets a single {@link ViolationKind#TYPE_ERROR} and its constraints are skipped.
 *
 * <p>Nested-record and collection-of-record fields run the complete two-phase pipeline of the
 * nested kind for each element; the nested violations are re-rooted under {@code field} or
 * {@code field[i]}.
 */
public final class FieldValidator {

    private static final String REQUIRED = "required";

    /** Runs the full pipeline for an embedded record. */
    @FunctionalInterface
    interface NestedPipeline {
        ValidationResult run(String recordKind, Map<String, ?> rawInput);
    }

    /**
     * Outcome of the field phase.
     *
     * @param fields typed values (null when any violation was found)
     * @param errors the violations (null when all fields passed)
     */
    public record Result(TypedFields fields, ValidationErrorReport errors) {

        public boolean valid() {
            return errors == null;
        }
    }

    private final ValueCoercer coercer;
    private final NestedPipeline nestedPipeline;

    FieldValidator(CoercionMode mode, NestedPipeline nestedPipeline) {
        this.coercer = new ValueCoercer(mode);
        this.nestedPipeline = nestedPipeline;
    }

    public CoercionMode coercionMode() {
        return coercer.mode();
    }

    /**
     * Validates all fields of {@code rawInput} against {@code schema}. Keys the schema does not
     * declare are ignored.
     */
    public Result validateFields(RecordSchema schema, Map<String, ?> rawInput) {
        var typed = new LinkedHashMap<String, Object>();
        var violations = new ArrayList<Violation>();

        for (FieldDeclaration field : schema.fields()) {
            FieldPath path = FieldPath.of(field.name());
            Object raw = rawInput.get(field.name());

            if (raw == null) {
                if (field.optional()) {
                    typed.put(field.name(), field.defaultValue());
                } else {
                    violations.add(new Violation(path, ViolationKind.TYPE_ERROR, "Field required",
                            Map.of("constraint", REQUIRED)));
                }
                continue;
            }

            var fieldViolations = new ArrayList<Violation>();
            Object value = switch (field.type()) {
                case NESTED_RECORD -> nestedRecord(field, path, raw, fieldViolations);
                case COLLECTION_OF_RECORD -> nestedRecords(field, path, raw, fieldViolations);
                default -> scalar(field, path, raw, fieldViolations);
            };

            if (fieldViolations.isEmpty()) {
                typed.put(field.name(), value);
            } else {
                violations.addAll(fieldViolations);
            }
        }

        if (!violations.isEmpty()) {
            return new Result(null, new ValidationErrorReport(violations));
        }
        return new Result(new TypedFields(schema.kind(), typed), null);
    }

    private Object scalar(FieldDeclaration field, FieldPath path, Object raw, List<Violation> out) {
        ValueCoercer.Coercion coercion = coercer.coerce(field, raw);
        if (!coercion.succeeded()) {
            out.add(typeError(path, raw, coercion.error(), field.type()));
            return null;
        }
        checkConstraints(field, path, coercion.value(), out);
        if (field.type() == SemanticType.ENUM_TAG && out.isEmpty()) {
            return ValueCoercer.resolveTag(field, (String) coercion.value());
        }
        return coercion.value();
    }

    private Object nestedRecord(FieldDeclaration field, FieldPath path, Object raw, List<Violation> out) {
        return element(field, path, raw, out);
    }

    private Object nestedRecords(FieldDeclaration field, FieldPath path, Object raw, List<Violation> out) {
        Optional<List<?>> elements = asList(raw);
        if (elements.isEmpty()) {
            out.add(typeError(path, raw, "Input should be a valid list", field.type()));
            return null;
        }

        var records = new ArrayList<ValidatedRecord>();
        List<?> items = elements.get();
        for (int i = 0; i < items.size(); i++) {
            ValidatedRecord record = element(field, path.index(i), items.get(i), out);
            if (record != null) {
                records.add(record);
            }
        }
        // size counts every supplied element, valid or not
        checkConstraints(field, path, items, out);
        return List.copyOf(records);
    }

    private ValidatedRecord element(FieldDeclaration field, FieldPath path, Object raw, List<Violation> out) {
        String kind = field.recordKind();
        if (raw instanceof ValidatedRecord record) {
            if (record.kind().equals(kind)) {
                return record;
            }
            out.add(typeError(path, record.kind(),
                    "Input should be a valid " + kind + " record, got a " + record.kind() + " record",
                    field.type()));
            return null;
        }
        if (raw instanceof Map<?, ?> map) {
            if (!map.keySet().stream().allMatch(String.class::isInstance)) {
                out.add(typeError(path, null, "Input should be a valid dictionary with string keys", field.type()));
                return null;
            }
            @SuppressWarnings("unchecked")
            Map<String, ?> nestedInput = (Map<String, ?>) map;
            ValidationResult nested = nestedPipeline.run(kind, nestedInput);
            if (nested.valid()) {
                return nested.record();
            }
            nested.violations().forEach(v -> out.add(v.under(path)));
            return null;
        }
        out.add(typeError(path, raw, "Input should be a valid dictionary or instance of " + kind, field.type()));
        return null;
    }

    private static void checkConstraints(FieldDeclaration field, FieldPath path, Object value, List<Violation> out) {
        for (Constraint constraint : field.constraints()) {
            constraint.check(path, value).ifPresent(out::add);
        }
    }

    private static Optional<List<?>> asList(Object raw) {
        if (raw instanceof List<?> list) {
            return Optional.of(list);
        }
        if (raw instanceof Collection<?> collection) {
            return Optional.of(new ArrayList<>(collection));
        }
        if (raw instanceof Object[] array) {
            return Optional.of(Arrays.asList(array));
        }
        return Optional.empty();
    }

    private static Violation typeError(FieldPath path, Object raw, String message, SemanticType expected) {
        var context = new LinkedHashMap<String, Object>();
        context.put("expected", expected.value());
        if (raw != null && !(raw instanceof Map) && !(raw instanceof Collection)) {
            context.put("value", raw);
        }
        return new Violation(path, ViolationKind.TYPE_ERROR, message, context);
    }
}

package com.aegis.validation;

import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the engine: {@code validate(recordKind, rawInput)}.
 *
 * <p>Runs the field phase ({@link FieldValidator}, exhaustive) and, only if it found nothing,
 * the business-rule phase ({@link BusinessRuleValidator}, first failure wins). Nested records go
 * through the same two phases recursively.
 *
 * <p>The engine holds no per-call state: one instance can serve concurrent callers, and calling
 * it twice with the same input yields equal results. It never keeps a reference to the input.
 *
 * <pre>{@code
 * ValidationEngine engine = ValidationEngine.builder(registry).build();
 * ValidationResult result = engine.validate("station", rawInput);
 * }</pre>
 */
public final class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    /** MDC key holding the record kind while a top-level validation runs. */
    public static final String MDC_RECORD_KIND = "recordKind";

    private final SchemaRegistry registry;
    private final FieldValidator fieldValidator;
    private final BusinessRuleValidator ruleValidator;
    private final ValidationListener listener;
    private final boolean logRejectionsAtWarn;

    private ValidationEngine(Builder builder) {
        this.registry = builder.registry;
        this.fieldValidator = new FieldValidator(builder.coercionMode, this::runNested);
        this.ruleValidator = new BusinessRuleValidator();
        this.listener = builder.listener;
        this.logRejectionsAtWarn = builder.logRejectionsAtWarn;
    }

    public static Builder builder(SchemaRegistry registry) {
        return new Builder(registry);
    }

    /**
     * Validates raw input against a registered record kind.
     *
     * @param recordKind a kind defined in the registry
     * @param rawInput field name to raw value; values may be nested maps and lists
     * @return ok with the validated record, or the error report
     * @throws UnknownRecordKindException if the kind is not registered (checked before any field)
     */
    public ValidationResult validate(String recordKind, Map<String, ?> rawInput) {
        RecordSchema schema = registry.lookup(recordKind);
        if (rawInput == null) {
            throw new IllegalArgumentException("rawInput must not be null");
        }

        long started = System.nanoTime();
        ValidationResult result;
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_RECORD_KIND, recordKind)) {
            result = run(schema, rawInput);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        if (result.valid()) {
            log.debug("Accepted '{}' record in {} µs", recordKind, elapsed.toNanos() / 1_000);
            listener.onAccepted(recordKind, elapsed);
        } else {
            logRejection(recordKind, result.errors());
            listener.onRejected(recordKind, result.errors(), elapsed);
        }
        return result;
    }

    /**
     * Parses a JSON object and validates it.
     *
     * @throws UnknownRecordKindException if the kind is not registered
     * @throws ValidationJson.ValidationJsonException if the text is not a JSON object
     */
    public ValidationResult validateJson(String recordKind, String json) {
        registry.lookup(recordKind);
        return validate(recordKind, ValidationJson.readRawInput(json));
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public CoercionMode coercionMode() {
        return fieldValidator.coercionMode();
    }

    private ValidationResult run(RecordSchema schema, Map<String, ?> rawInput) {
        FieldValidator.Result fields = fieldValidator.validateFields(schema, rawInput);
        if (!fields.valid()) {
            return ValidationResult.fail(schema.kind(), fields.errors());
        }
        return ruleValidator.validateRules(schema, fields.fields());
    }

    private ValidationResult runNested(String recordKind, Map<String, ?> rawInput) {
        return run(registry.lookup(recordKind), rawInput);
    }

    private void logRejection(String recordKind, ValidationErrorReport report) {
        if (logRejectionsAtWarn) {
            log.warn("Rejected '{}' record with {} violation(s): {}", recordKind, report.size(), report.violations());
        } else if (log.isDebugEnabled()) {
            log.debug("Rejected '{}' record with {} violation(s): {}", recordKind, report.size(), report.violations());
        }
    }

    /** Builder for {@link ValidationEngine}. */
    public static final class Builder {

        private final SchemaRegistry registry;
        private CoercionMode coercionMode = CoercionMode.LAX;
        private ValidationListener listener = ValidationListener.NOOP;
        private boolean logRejectionsAtWarn;

        private Builder(SchemaRegistry registry) {
            if (registry == null) {
                throw new IllegalArgumentException("registry must not be null");
            }
            this.registry = registry;
        }

        public Builder coercionMode(CoercionMode coercionMode) {
            if (coercionMode == null) {
                throw new IllegalArgumentException("coercionMode must not be null");
            }
            this.coercionMode = coercionMode;
            return this;
        }

        public Builder listener(ValidationListener listener) {
            if (listener == null) {
                throw new IllegalArgumentException("listener must not be null");
            }
            this.listener = listener;
            return this;
        }

        public Builder logRejectionsAtWarn(boolean logRejectionsAtWarn) {
            this.logRejectionsAtWarn = logRejectionsAtWarn;
            return this;
        }

        public ValidationEngine build() {
            return new ValidationEngine(this);
        }
    }
}

package com.aegis.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Builds validation meters scoped to one service and one record kind.
 * <p>
 * Every meter carries {@code service} and {@code record_kind} tags. Micrometer returns the
 * already-registered meter for a repeated name and tag set, so callers ask for the meter on every
 * event instead of holding one per kind.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_RECORD_KIND = "record_kind";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry
     * @param serviceName value of the {@code service} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Counter of records of one kind.
     *
     * @param name        metric name (e.g., "aegis.validation.accepted")
     * @param description human-readable description
     * @param recordKind  the record kind the counter is for
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String recordKind, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(kindTags(recordKind, tags))
                .register(registry);
    }

    /** Timer of validation runs for one kind. */
    public Timer timer(String name, String description, String recordKind, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(kindTags(recordKind, tags))
                .register(registry);
    }

    /** Per-record violation counts for one kind, in units of violations. */
    public DistributionSummary violationSummary(String name, String description, String recordKind) {
        return DistributionSummary.builder(name)
                .description(description)
                .baseUnit("violations")
                .tags(kindTags(recordKind))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags kindTags(String recordKind, String... extraTags) {
        if (recordKind == null || recordKind.isBlank()) {
            throw new IllegalArgumentException("recordKind must not be null or blank");
        }
        return Tags.of(TAG_SERVICE, serviceName, TAG_RECORD_KIND, recordKind).and(extraTags);
    }
}

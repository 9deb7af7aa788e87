package com.aegis.observability;

import com.aegis.validation.ValidationErrorReport;
import com.aegis.validation.ValidationListener;
import com.aegis.validation.ViolationKind;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

/**
 * Records validation outcomes as Micrometer meters.
 * <p>
 * Meters, all tagged with {@code service} and {@code record_kind}:
 * <ul>
 *   <li>{@value #ACCEPTED} counter</li>
 *   <li>{@value #REJECTED} counter, tagged {@code phase=field|rule}</li>
 *   <li>{@value #VIOLATIONS} summary of violations per rejected record</li>
 *   <li>{@value #DURATION} timer, tagged {@code outcome=accepted|rejected}</li>
 * </ul>
 */
public final class ValidationMetrics implements ValidationListener {

    public static final String ACCEPTED = "aegis.validation.accepted";
    public static final String REJECTED = "aegis.validation.rejected";
    public static final String VIOLATIONS = "aegis.validation.violations";
    public static final String DURATION = "aegis.validation.duration";

    public static final String TAG_RECORD_KIND = MetricFactory.TAG_RECORD_KIND;
    public static final String TAG_PHASE = "phase";
    public static final String TAG_OUTCOME = "outcome";

    private final MetricFactory metrics;

    public ValidationMetrics(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    @Override
    public void onAccepted(String recordKind, Duration elapsed) {
        metrics.counter(ACCEPTED, "Records that passed validation", recordKind).increment();
        duration(recordKind, "accepted").record(elapsed);
    }

    @Override
    public void onRejected(String recordKind, ValidationErrorReport report, Duration elapsed) {
        String phase = failedInRulePhase(report) ? "rule" : "field";
        metrics.counter(REJECTED, "Records that failed validation", recordKind, TAG_PHASE, phase).increment();
        metrics.violationSummary(VIOLATIONS, "Violations per rejected record", recordKind).record(report.size());
        duration(recordKind, "rejected").record(elapsed);
    }

    // nested rule failures surface in the field phase at a non-root path
    private static boolean failedInRulePhase(ValidationErrorReport report) {
        return report.violations().stream()
                .anyMatch(v -> v.kind() == ViolationKind.BUSINESS_RULE_ERROR && v.path().isRoot());
    }

    private Timer duration(String recordKind, String outcome) {
        return metrics.timer(DURATION, "Time spent validating one record", recordKind, TAG_OUTCOME, outcome);
    }
}

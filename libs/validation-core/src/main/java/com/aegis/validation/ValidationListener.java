package com.aegis.validation;

import java.time.Duration;

/**
 * Callback for the outcome of each top-level {@link ValidationEngine#validate} call. Nested
 * records are not reported separately.
 *
 * <p>Implementations must be thread-safe; the engine calls them from whichever thread validated.
 */
public interface ValidationListener {

    /** Listener that ignores every outcome. */
    ValidationListener NOOP = new ValidationListener() {};

    default void onAccepted(String recordKind, Duration elapsed) {}

    default void onRejected(String recordKind, ValidationErrorReport report, Duration elapsed) {}
}

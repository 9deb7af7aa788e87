package com.aegis.validation.config;

import com.aegis.validation.CoercionMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the validation engine, bound from {@code aegis.validation.*}.
 *
 * <pre>{@code
 * aegis:
 *   validation:
 *     coercion-mode: lax
 *     log-rejections-at-warn: false
 *     metrics-enabled: true
 *     service-name: mission-control
 * }</pre>
 *
 * @param coercionMode how permissive raw-value coercion is (default {@code LAX})
 * @param logRejectionsAtWarn log each rejected record at WARN instead of DEBUG
 * @param metricsEnabled publish Micrometer meters when a {@code MeterRegistry} bean exists
 *     (default true)
 * @param serviceName value of the {@code service} tag on every meter (default
 *     {@value #DEFAULT_SERVICE_NAME})
 */
@Validated
@ConfigurationProperties(prefix = "aegis.validation")
public record ValidationProperties(
        @NotNull CoercionMode coercionMode,
        boolean logRejectionsAtWarn,
        Boolean metricsEnabled,
        @NotBlank String serviceName) {

    public static final String DEFAULT_SERVICE_NAME = "aegis-validation";

    /**
     * Compact constructor: applies defaults for unset properties before Bean Validation runs.
     */
    public ValidationProperties {
        if (coercionMode == null) {
            coercionMode = CoercionMode.LAX;
        }
        if (metricsEnabled == null) {
            metricsEnabled = Boolean.TRUE;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
    }

    /** All defaults. */
    public static ValidationProperties defaults() {
        return new ValidationProperties(null, false, null, null);
    }
}

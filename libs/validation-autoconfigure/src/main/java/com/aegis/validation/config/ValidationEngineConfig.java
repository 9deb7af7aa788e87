package com.aegis.validation.config;

import com.aegis.observability.MetricFactory;
import com.aegis.observability.ValidationMetrics;
import com.aegis.records.SpaceRecordCatalog;
import com.aegis.validation.SchemaRegistry;
import com.aegis.validation.ValidationEngine;
import com.aegis.validation.ValidationListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring wiring for the validation engine.
 *
 * <h2>Beans</h2>
 *
 * <ul>
 *   <li>{@link #SCHEMA_REGISTRY_BEAN} : registry holding every space record kind
 *   <li>{@link #VALIDATION_LISTENER_BEAN} : Micrometer metrics when enabled and a
 *       {@link MeterRegistry} bean exists, otherwise a no-op listener
 *   <li>{@link #VALIDATION_ENGINE_BEAN} : the engine, configured from {@link ValidationProperties}
 * </ul>
 *
 * <p>Each bean backs off when the application defines its own bean of the same type.
 */
@AutoConfiguration
@EnableConfigurationProperties(ValidationProperties.class)
public class ValidationEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngineConfig.class);

    public static final String SCHEMA_REGISTRY_BEAN = "aegisSchemaRegistry";
    public static final String VALIDATION_LISTENER_BEAN = "aegisValidationListener";
    public static final String VALIDATION_ENGINE_BEAN = "aegisValidationEngine";

    @Bean(name = SCHEMA_REGISTRY_BEAN)
    @ConditionalOnMissingBean
    public SchemaRegistry schemaRegistry() {
        return SpaceRecordCatalog.newRegistry();
    }

    @Bean(name = VALIDATION_LISTENER_BEAN)
    @ConditionalOnMissingBean
    public ValidationListener validationListener(
            ValidationProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (!properties.metricsEnabled() || registry == null) {
            log.info("Validation metrics disabled (enabled={}, meterRegistry={})",
                    properties.metricsEnabled(), registry != null);
            return ValidationListener.NOOP;
        }
        return new ValidationMetrics(new MetricFactory(registry, properties.serviceName()));
    }

    @Bean(name = VALIDATION_ENGINE_BEAN)
    @ConditionalOnMissingBean
    public ValidationEngine validationEngine(
            SchemaRegistry schemaRegistry, ValidationProperties properties, ValidationListener listener) {
        log.info("Validation engine for kinds {} (coercion={})", schemaRegistry.kinds(), properties.coercionMode());
        return ValidationEngine.builder(schemaRegistry)
                .coercionMode(properties.coercionMode())
                .logRejectionsAtWarn(properties.logRejectionsAtWarn())
                .listener(listener)
                .build();
    }
}

package com.aegis.validation;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-once registry of record schemas, keyed by record kind.
 *
 * <p>Populated during initialization and read-only afterwards, so one instance can be shared by
 * any number of concurrent validations. A kind can be defined only once; nested record kinds must
 * be defined before the schemas that embed them (a schema may embed its own kind).
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, RecordSchema> schemas = new ConcurrentHashMap<>();

    /**
     * Registers a schema.
     *
     * @param schema the schema to register
     * @return the registered schema
     * @throws SchemaDefinitionException if the kind is already defined or a nested kind is unknown
     */
    public RecordSchema define(RecordSchema schema) {
        if (schema == null) {
            throw new SchemaDefinitionException("schema must not be null");
        }
        for (FieldDeclaration field : schema.fields()) {
            field.nestedKind()
                    .filter(nested -> !nested.equals(schema.kind()) && !schemas.containsKey(nested))
                    .ifPresent(nested -> {
                        throw new SchemaDefinitionException(
                                "schema '%s' field '%s' embeds undefined record kind '%s'"
                                        .formatted(schema.kind(), field.name(), nested));
                    });
        }
        if (schemas.putIfAbsent(schema.kind(), schema) != null) {
            throw new SchemaDefinitionException("record kind '" + schema.kind() + "' is already defined");
        }
        log.info("Defined record kind '{}' with {} field(s) and {} rule(s)",
                schema.kind(), schema.fields().size(), schema.rules().size());
        return schema;
    }

    /**
     * Returns the schema for a kind.
     *
     * @throws UnknownRecordKindException if the kind was never defined
     */
    public RecordSchema lookup(String kind) {
        RecordSchema schema = kind == null ? null : schemas.get(kind);
        if (schema == null) {
            throw new UnknownRecordKindException(kind);
        }
        return schema;
    }

    public boolean isDefined(String kind) {
        return kind != null && schemas.containsKey(kind);
    }

    /** Snapshot of the defined kinds. */
    public Set<String> kinds() {
        return Set.copyOf(schemas.keySet());
    }

    public int size() {
        return schemas.size();
    }
}

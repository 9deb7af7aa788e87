package com.aegis.validation;

/**
 * Thrown when a schema is malformed or would change an already-registered one: duplicate field
 * names, inapplicable constraints, a nested kind that is not registered, or redefining a kind.
 *
 * <p>Schemas are built at process start, so this is a programming error rather than a
 * validation outcome.
 */
public class SchemaDefinitionException extends RuntimeException {

    public SchemaDefinitionException(String message) {
        super(message);
    }
}

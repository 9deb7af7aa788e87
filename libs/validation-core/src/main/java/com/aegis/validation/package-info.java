/**
 * Declarative record validation.
 *
 * <p>A {@link com.aegis.validation.RecordSchema} declares the fields of one record kind
 * ({@link com.aegis.validation.FieldDeclaration}: type, optionality, constraints) and its ordered
 * {@link com.aegis.validation.BusinessRule}s. Schemas live in a write-once
 * {@link com.aegis.validation.SchemaRegistry}. {@link com.aegis.validation.ValidationEngine} turns
 * raw input into a {@link com.aegis.validation.ValidationResult}:
 *
 * <ol>
 *   <li>field phase: coercion plus every constraint of every field, all violations collected;
 *   <li>rule phase, only when the field phase is clean: rules in order, first failure reported.
 * </ol>
 *
 * <p>Only the rule phase's success path creates a {@link com.aegis.validation.ValidatedRecord}.
 */
package com.aegis.validation;

package com.aegis.validation;

/**
 * How permissive raw-value coercion is.
 *
 * <ul>
 *   <li>{@link #LAX}: numeric and boolean text is parsed, integral floats are accepted as integers,
 *       and {@code 0}/{@code 1} are accepted as booleans.
 *   <li>{@link #STRICT}: only values whose Java type already matches are accepted. Timestamps
 *       still accept ISO-8601 text and enum tags still accept their tag text.
 * </ul>
 */
public enum CoercionMode {
    LAX,
    STRICT
}

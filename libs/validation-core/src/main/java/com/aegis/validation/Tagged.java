package com.aegis.validation;

/**
 * Implemented by the enums backing {@link SemanticType#ENUM_TAG} fields.
 *
 * <p>The tag is the text form accepted in raw input (e.g. {@code "captain"}) and rendered in
 * messages and JSON.
 */
public interface Tagged {

    /** The canonical tag string for this constant. */
    String tag();
}

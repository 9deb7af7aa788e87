package com.aegis.records;

import com.aegis.validation.Tagged;
import java.util.Optional;

/**
 * How an alien contact was made.
 */
public enum ContactType implements Tagged {

    RADIO("radio"),
    VISUAL("visual"),
    PHYSICAL("physical"),
    TELEPATHIC("telepathic");

    private final String tag;

    ContactType(String tag) {
        this.tag = tag;
    }

    @Override
    public String tag() {
        return tag;
    }

    /**
     * Looks up a ContactType by its tag (e.g. "radio").
     *
     * @param tag the string to match
     * @return the matching ContactType, or empty if not found
     */
    public static Optional<ContactType> fromTag(String tag) {
        for (ContactType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package com.aegis.records;

import com.aegis.validation.Tagged;
import java.util.Optional;

/**
 * Crew ranks, lowest first.
 */
public enum Rank implements Tagged {

    CADET("cadet"),
    OFFICER("officer"),
    LIEUTENANT("lieutenant"),
    CAPTAIN("captain"),
    COMMANDER("commander");

    private final String tag;

    Rank(String tag) {
        this.tag = tag;
    }

    @Override
    public String tag() {
        return tag;
    }

    /** Whether this rank can lead a mission (captain or commander). */
    public boolean isLeadership() {
        return switch (this) {
            case CAPTAIN, COMMANDER -> true;
            case CADET, OFFICER, LIEUTENANT -> false;
        };
    }

    /**
     * Looks up a Rank by its tag (e.g. "captain").
     *
     * @param tag the string to match
     * @return the matching Rank, or empty if not found
     */
    public static Optional<Rank> fromTag(String tag) {
        for (Rank rank : values()) {
            if (rank.tag.equals(tag)) {
                return Optional.of(rank);
            }
        }
        return Optional.empty();
    }
}

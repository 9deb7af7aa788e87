package com.aegis.records;

import static com.aegis.records.MissionSchema.CREW;
import static com.aegis.records.MissionSchema.DURATION_DAYS;
import static com.aegis.records.MissionSchema.ID_PREFIX;
import static com.aegis.records.MissionSchema.MISSION_ID;

import com.aegis.validation.BusinessRule;
import com.aegis.validation.TypedFields;
import com.aegis.validation.ValidatedRecord;
import java.util.List;

/**
 * Business rules of a mission, in evaluation order. Crew members are already validated records
 * when these run.
 */
public enum MissionRule implements BusinessRule {

    MISSION_ID_PREFIX("Mission ID must start with 'M'"),
    LEADERSHIP_PRESENT("Mission must have at least one Captain or Commander"),
    EXPERIENCED_CREW_FOR_LONG_MISSIONS("Long missions require at least 50% experienced crew (5+ years)"),
    ALL_CREW_ACTIVE("All crew members must be active");

    /** Missions longer than this many days are long missions. */
    public static final long LONG_MISSION_DAYS = 365;

    /** Years of experience that make a crew member experienced. */
    public static final long EXPERIENCED_YEARS = 5;

    private final String message;

    MissionRule(String message) {
        this.message = message;
    }

    @Override
    public String message() {
        return message;
    }

    @Override
    public boolean isSatisfiedBy(TypedFields mission) {
        List<ValidatedRecord> crew = mission.getRecords(CREW);
        return switch (this) {
            case MISSION_ID_PREFIX -> mission.getString(MISSION_ID).startsWith(ID_PREFIX);
            case LEADERSHIP_PRESENT -> crew.stream()
                    .anyMatch(member -> member.getEnum(CrewMemberSchema.RANK, Rank.class).isLeadership());
            case EXPERIENCED_CREW_FOR_LONG_MISSIONS -> mission.getLong(DURATION_DAYS) <= LONG_MISSION_DAYS
                    || hasExperiencedHalf(crew);
            case ALL_CREW_ACTIVE -> crew.stream()
                    .allMatch(member -> member.getBoolean(CrewMemberSchema.IS_ACTIVE));
        };
    }

    /** At least half the crew (real division, not rounded) has {@value #EXPERIENCED_YEARS}+ years. */
    private static boolean hasExperiencedHalf(List<ValidatedRecord> crew) {
        long experienced = crew.stream()
                .filter(member -> member.getLong(CrewMemberSchema.YEARS_EXPERIENCE) >= EXPERIENCED_YEARS)
                .count();
        return experienced >= crew.size() / 2.0;
    }
}

package com.aegis.records;

import static com.aegis.records.CrewMemberSchema.*;

import com.aegis.validation.ValidatedRecord;

/**
 * Read-only view of a validated crew member.
 */
public record CrewMember(
        String memberId,
        String name,
        Rank rank,
        int age,
        String specialization,
        int yearsExperience,
        boolean active) {

    /** Builds the view from a validated {@value CrewMemberSchema#KIND} record. */
    public static CrewMember from(ValidatedRecord record) {
        RecordViews.requireKind(record, KIND);
        return new CrewMember(
                record.getString(MEMBER_ID),
                record.getString(NAME),
                record.getEnum(RANK, Rank.class),
                record.getInt(AGE),
                record.getString(SPECIALIZATION),
                record.getInt(YEARS_EXPERIENCE),
                record.getBoolean(IS_ACTIVE));
    }
}

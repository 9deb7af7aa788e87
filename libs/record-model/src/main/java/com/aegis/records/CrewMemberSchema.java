package com.aegis.records;

import com.aegis.validation.FieldDeclaration;
import com.aegis.validation.RecordSchema;

/**
 * Schema of one crew member, embedded in missions.
 */
public final class CrewMemberSchema {

    public static final String KIND = "crew_member";

    public static final String MEMBER_ID = "member_id";
    public static final String NAME = "name";
    public static final String RANK = "rank";
    public static final String AGE = "age";
    public static final String SPECIALIZATION = "specialization";
    public static final String YEARS_EXPERIENCE = "years_experience";
    public static final String IS_ACTIVE = "is_active";

    private CrewMemberSchema() {
        // utility class
    }

    public static RecordSchema definition() {
        return RecordSchema.builder(KIND)
                .field(FieldDeclaration.string(MEMBER_ID).length(3, 10))
                .field(FieldDeclaration.string(NAME).length(2, 50))
                .field(FieldDeclaration.enumTag(RANK, Rank.class))
                .field(FieldDeclaration.integer(AGE).range(18, 80))
                .field(FieldDeclaration.string(SPECIALIZATION).length(3, 30))
                .field(FieldDeclaration.integer(YEARS_EXPERIENCE).range(0, 50))
                .field(FieldDeclaration.bool(IS_ACTIVE).withDefault(true))
                .build();
    }
}

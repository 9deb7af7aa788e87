package com.aegis.records;

import com.aegis.validation.FieldDeclaration;
import com.aegis.validation.RecordSchema;

/**
 * Schema of a space mission. The crew is a collection of {@link CrewMemberSchema} records, each
 * validated in full before the mission's own rules ({@link MissionRule}) run.
 */
public final class MissionSchema {

    public static final String KIND = "mission";

    /** Every mission id starts with this tag. */
    public static final String ID_PREFIX = "M";

    public static final String MISSION_ID = "mission_id";
    public static final String MISSION_NAME = "mission_name";
    public static final String DESTINATION = "destination";
    public static final String LAUNCH_DATE = "launch_date";
    public static final String DURATION_DAYS = "duration_days";
    public static final String CREW = "crew";
    public static final String MISSION_STATUS = "mission_status";
    public static final String BUDGET_MILLIONS = "budget_millions";

    public static final String DEFAULT_STATUS = "planned";

    private MissionSchema() {
        // utility class
    }

    /** Requires {@link CrewMemberSchema} to be registered first. */
    public static RecordSchema definition() {
        return RecordSchema.builder(KIND)
                .field(FieldDeclaration.string(MISSION_ID).length(5, 15))
                .field(FieldDeclaration.string(MISSION_NAME).length(3, 100))
                .field(FieldDeclaration.string(DESTINATION).length(3, 50))
                .field(FieldDeclaration.timestamp(LAUNCH_DATE))
                .field(FieldDeclaration.integer(DURATION_DAYS).range(1, 3650))
                .field(FieldDeclaration.records(CREW, CrewMemberSchema.KIND).size(1, 12))
                .field(FieldDeclaration.string(MISSION_STATUS).withDefault(DEFAULT_STATUS))
                .field(FieldDeclaration.number(BUDGET_MILLIONS).range(1.0, 10000.0))
                .rules(MissionRule.values())
                .build();
    }
}

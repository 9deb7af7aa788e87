package com.aegis.records;

import com.aegis.validation.FieldDeclaration;
import com.aegis.validation.RecordSchema;

/**
 * Schema of a space station status record. Field constraints only; no business rules.
 */
public final class StationSchema {

    public static final String KIND = "station";

    public static final String STATION_ID = "station_id";
    public static final String NAME = "name";
    public static final String CREW_SIZE = "crew_size";
    public static final String POWER_LEVEL = "power_level";
    public static final String OXYGEN_LEVEL = "oxygen_level";
    public static final String LAST_MAINTENANCE = "last_maintenance";
    public static final String IS_OPERATIONAL = "is_operational";
    public static final String NOTES = "notes";

    private StationSchema() {
        // utility class
    }

    public static RecordSchema definition() {
        return RecordSchema.builder(KIND)
                .field(FieldDeclaration.string(STATION_ID).length(3, 10))
                .field(FieldDeclaration.string(NAME).length(1, 50))
                .field(FieldDeclaration.integer(CREW_SIZE).range(1, 20))
                .field(FieldDeclaration.number(POWER_LEVEL).range(0.0, 100.0))
                .field(FieldDeclaration.number(OXYGEN_LEVEL).range(0.0, 100.0))
                .field(FieldDeclaration.timestamp(LAST_MAINTENANCE))
                .field(FieldDeclaration.bool(IS_OPERATIONAL).withDefault(true))
                .field(FieldDeclaration.string(NOTES).length(0, 200).asOptional())
                .build();
    }
}

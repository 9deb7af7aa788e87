package com.aegis.records;

import static com.aegis.records.StationSchema.*;

import com.aegis.validation.ValidatedRecord;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Read-only view of a validated station record.
 *
 * @param stationId 3-10 characters
 * @param name 1-50 characters
 * @param crewSize 1-20 people
 * @param powerLevel percent, 0-100
 * @param oxygenLevel percent, 0-100
 * @param lastMaintenance when the station was last serviced (UTC)
 * @param operational whether the station is operational
 * @param notes free text up to 200 characters, if any
 */
public record Station(
        String stationId,
        String name,
        int crewSize,
        double powerLevel,
        double oxygenLevel,
        OffsetDateTime lastMaintenance,
        boolean operational,
        Optional<String> notes) {

    /** Builds the view from a validated {@value StationSchema#KIND} record. */
    public static Station from(ValidatedRecord record) {
        RecordViews.requireKind(record, KIND);
        return new Station(
                record.getString(STATION_ID),
                record.getString(NAME),
                record.getInt(CREW_SIZE),
                record.getDouble(POWER_LEVEL),
                record.getDouble(OXYGEN_LEVEL),
                record.getTimestamp(LAST_MAINTENANCE),
                record.getBoolean(IS_OPERATIONAL),
                record.find(NOTES, String.class));
    }
}

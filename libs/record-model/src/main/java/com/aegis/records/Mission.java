package com.aegis.records;

import static com.aegis.records.MissionSchema.*;

import com.aegis.validation.ValidatedRecord;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read-only view of a validated mission and its crew.
 */
public record Mission(
        String missionId,
        String missionName,
        String destination,
        OffsetDateTime launchDate,
        int durationDays,
        List<CrewMember> crew,
        String missionStatus,
        double budgetMillions) {

    public Mission {
        crew = List.copyOf(crew);
    }

    /** Builds the view from a validated {@value MissionSchema#KIND} record. */
    public static Mission from(ValidatedRecord record) {
        RecordViews.requireKind(record, KIND);
        return new Mission(
                record.getString(MISSION_ID),
                record.getString(MISSION_NAME),
                record.getString(DESTINATION),
                record.getTimestamp(LAUNCH_DATE),
                record.getInt(DURATION_DAYS),
                record.getRecords(CREW).stream().map(CrewMember::from).toList(),
                record.getString(MISSION_STATUS),
                record.getDouble(BUDGET_MILLIONS));
    }

    /** Crew members holding a leadership rank. */
    public List<CrewMember> leaders() {
        return crew.stream().filter(member -> member.rank().isLeadership()).toList();
    }
}

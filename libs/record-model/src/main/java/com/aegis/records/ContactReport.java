package com.aegis.records;

import static com.aegis.records.ContactReportSchema.*;

import com.aegis.validation.ValidatedRecord;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Read-only view of a validated contact report.
 */
public record ContactReport(
        String contactId,
        OffsetDateTime timestamp,
        String location,
        ContactType contactType,
        double signalStrength,
        int durationMinutes,
        int witnessCount,
        Optional<String> messageReceived,
        boolean verified) {

    /** Builds the view from a validated {@value ContactReportSchema#KIND} record. */
    public static ContactReport from(ValidatedRecord record) {
        RecordViews.requireKind(record, KIND);
        return new ContactReport(
                record.getString(CONTACT_ID),
                record.getTimestamp(TIMESTAMP),
                record.getString(LOCATION),
                record.getEnum(CONTACT_TYPE, ContactType.class),
                record.getDouble(SIGNAL_STRENGTH),
                record.getInt(DURATION_MINUTES),
                record.getInt(WITNESS_COUNT),
                record.find(MESSAGE_RECEIVED, String.class),
                record.getBoolean(IS_VERIFIED));
    }
}

package com.aegis.records;

import com.aegis.validation.FieldDeclaration;
import com.aegis.validation.RecordSchema;

/**
 * Schema of an alien contact report. Rules: {@link ContactReportRule}.
 */
public final class ContactReportSchema {

    public static final String KIND = "contact_report";

    /** Every contact id starts with this tag ("Alien Contact"). */
    public static final String ID_PREFIX = "AC";

    public static final String CONTACT_ID = "contact_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String LOCATION = "location";
    public static final String CONTACT_TYPE = "contact_type";
    public static final String SIGNAL_STRENGTH = "signal_strength";
    public static final String DURATION_MINUTES = "duration_minutes";
    public static final String WITNESS_COUNT = "witness_count";
    public static final String MESSAGE_RECEIVED = "message_received";
    public static final String IS_VERIFIED = "is_verified";

    private ContactReportSchema() {
        // utility class
    }

    public static RecordSchema definition() {
        return RecordSchema.builder(KIND)
                .field(FieldDeclaration.string(CONTACT_ID).length(5, 15))
                .field(FieldDeclaration.timestamp(TIMESTAMP))
                .field(FieldDeclaration.string(LOCATION).length(3, 100))
                .field(FieldDeclaration.enumTag(CONTACT_TYPE, ContactType.class))
                .field(FieldDeclaration.number(SIGNAL_STRENGTH).range(0.0, 10.0))
                .field(FieldDeclaration.integer(DURATION_MINUTES).range(1, 1440))
                .field(FieldDeclaration.integer(WITNESS_COUNT).range(1, 100))
                .field(FieldDeclaration.string(MESSAGE_RECEIVED).length(0, 500).asOptional())
                .field(FieldDeclaration.bool(IS_VERIFIED).withDefault(false))
                .rules(ContactReportRule.values())
                .build();
    }
}

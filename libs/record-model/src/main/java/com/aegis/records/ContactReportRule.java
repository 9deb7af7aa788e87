package com.aegis.records;

import static com.aegis.records.ContactReportSchema.CONTACT_ID;
import static com.aegis.records.ContactReportSchema.CONTACT_TYPE;
import static com.aegis.records.ContactReportSchema.ID_PREFIX;
import static com.aegis.records.ContactReportSchema.IS_VERIFIED;
import static com.aegis.records.ContactReportSchema.MESSAGE_RECEIVED;
import static com.aegis.records.ContactReportSchema.SIGNAL_STRENGTH;
import static com.aegis.records.ContactReportSchema.WITNESS_COUNT;

import com.aegis.validation.BusinessRule;
import com.aegis.validation.TypedFields;

/**
 * Business rules of a contact report, in evaluation order.
 */
public enum ContactReportRule implements BusinessRule {

    CONTACT_ID_PREFIX("Contact ID must start with 'AC' (Alien Contact)"),
    PHYSICAL_CONTACT_VERIFIED("Physical contact reports must be verified"),
    TELEPATHIC_WITNESSES("Telepathic contact requires at least 3 witnesses"),
    STRONG_SIGNAL_MESSAGE("Strong signals (> 7.0) should include a received message");

    /** Minimum witnesses for a telepathic contact. */
    public static final int MIN_TELEPATHIC_WITNESSES = 3;

    /** Signal strength above which a received message is mandatory. */
    public static final double STRONG_SIGNAL_THRESHOLD = 7.0;

    private final String message;

    ContactReportRule(String message) {
        this.message = message;
    }

    @Override
    public String message() {
        return message;
    }

    @Override
    public boolean isSatisfiedBy(TypedFields report) {
        ContactType type = report.getEnum(CONTACT_TYPE, ContactType.class);
        return switch (this) {
            case CONTACT_ID_PREFIX -> report.getString(CONTACT_ID).startsWith(ID_PREFIX);
            case PHYSICAL_CONTACT_VERIFIED -> type != ContactType.PHYSICAL || report.getBoolean(IS_VERIFIED);
            case TELEPATHIC_WITNESSES ->
                    type != ContactType.TELEPATHIC || report.getLong(WITNESS_COUNT) >= MIN_TELEPATHIC_WITNESSES;
            case STRONG_SIGNAL_MESSAGE -> report.getDouble(SIGNAL_STRENGTH) <= STRONG_SIGNAL_THRESHOLD
                    || report.find(MESSAGE_RECEIVED, String.class).filter(m -> !m.isEmpty()).isPresent();
        };
    }
}

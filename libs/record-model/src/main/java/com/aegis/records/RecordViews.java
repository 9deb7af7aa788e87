package com.aegis.records;

import com.aegis.validation.ValidatedRecord;

final class RecordViews {

    private RecordViews() {
        // utility class
    }

    static ValidatedRecord requireKind(ValidatedRecord record, String kind) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        if (!record.kind().equals(kind)) {
            throw new IllegalArgumentException(
                    "expected a '%s' record, got '%s'".formatted(kind, record.kind()));
        }
        return record;
    }
}

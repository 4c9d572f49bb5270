package com.ai.clinic.time;

import com.ai.clinic.config.ClinicProperties;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Clinic open hours: 9-13 and 14-18 local time, every day.
 */
@Component
public class WorkingHoursPolicy {

    static final LocalTime OPENING = LocalTime.of(9, 0);
    static final LocalTime LUNCH_START = LocalTime.of(13, 0);
    static final LocalTime LUNCH_END = LocalTime.of(14, 0);
    static final LocalTime CLOSING = LocalTime.of(18, 0);

    private final ZoneOffset offset;

    public WorkingHoursPolicy(ClinicProperties properties) {
        this.offset = properties.offset();
    }

    public boolean withinHours(OffsetDateTime instant) {
        LocalTime local = instant.withOffsetSameInstant(offset).toLocalTime();
        if (local.isBefore(OPENING) || !local.isBefore(CLOSING)) {
            return false;
        }
        return local.isBefore(LUNCH_START) || !local.isBefore(LUNCH_END);
    }

    /** Both endpoints are checked, so a slot may not straddle lunch or closing. */
    public boolean allows(SlotInterval slot) {
        return withinHours(slot.start()) && withinHours(slot.end());
    }
}

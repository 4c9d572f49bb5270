package com.ai.clinic.calendar;

import java.time.OffsetDateTime;

/**
 * Event as seen by availability checks. All-day entries carry no start/end instant.
 */
public record CalendarEvent(String id, String summary, OffsetDateTime start, OffsetDateTime end) {

    public static CalendarEvent allDay(String id, String summary) {
        return new CalendarEvent(id, summary, null, null);
    }

    public boolean isTimed() {
        return start != null && end != null;
    }
}

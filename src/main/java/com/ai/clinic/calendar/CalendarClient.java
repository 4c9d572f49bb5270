package com.ai.clinic.calendar;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * External event store holding the clinic's bookings.
 * Implementations raise {@link com.ai.clinic.exception.SchedulingException} with
 * {@code CALENDAR_UNAVAILABLE} when the backend cannot be reached.
 */
public interface CalendarClient {

    /** Events overlapping {@code [timeMin, timeMax)}, all-day entries included. */
    List<CalendarEvent> listEvents(OffsetDateTime timeMin, OffsetDateTime timeMax);

    /** @return the new event's id */
    String createEvent(String summary, String description, OffsetDateTime start, OffsetDateTime end, String timeZone);

    /** Moves an existing event. @return the event id after the move */
    String updateEvent(String eventId, OffsetDateTime newStart, OffsetDateTime newEnd);

    /** Idempotent: deleting a missing event is not an error. */
    void deleteEvent(String eventId);
}

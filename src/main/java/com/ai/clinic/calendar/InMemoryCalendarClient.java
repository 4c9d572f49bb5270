package com.ai.clinic.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local calendar used when Google Calendar is disabled (local runs, tests).
 */
@Component
@ConditionalOnProperty(prefix = "app.google.calendar", name = "enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryCalendarClient implements CalendarClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCalendarClient.class);

    private final Map<String, CalendarEvent> events = new ConcurrentHashMap<>();
    private final Map<String, LocalDate> allDayEvents = new ConcurrentHashMap<>();

    @Override
    public List<CalendarEvent> listEvents(OffsetDateTime timeMin, OffsetDateTime timeMax) {
        List<CalendarEvent> result = new ArrayList<>();
        events.values().stream()
                .filter(e -> e.start().isBefore(timeMax) && e.end().isAfter(timeMin))
                .sorted(Comparator.comparing(CalendarEvent::start))
                .forEach(result::add);
        allDayEvents.forEach((id, date) -> {
            if (!date.isBefore(timeMin.toLocalDate()) && !date.isAfter(timeMax.toLocalDate())) {
                result.add(CalendarEvent.allDay(id, "All-day"));
            }
        });
        return result;
    }

    @Override
    public String createEvent(String summary, String description, OffsetDateTime start, OffsetDateTime end, String timeZone) {
        String id = UUID.randomUUID().toString();
        events.put(id, new CalendarEvent(id, summary, start, end));
        log.info("Created local calendar event {} for {} - {}", id, start, end);
        return id;
    }

    @Override
    public String updateEvent(String eventId, OffsetDateTime newStart, OffsetDateTime newEnd) {
        CalendarEvent existing = events.get(eventId);
        if (existing == null) {
            throw new IllegalStateException("Calendar event " + eventId + " does not exist");
        }
        events.put(eventId, new CalendarEvent(eventId, existing.summary(), newStart, newEnd));
        return eventId;
    }

    @Override
    public void deleteEvent(String eventId) {
        events.remove(eventId);
        allDayEvents.remove(eventId);
    }

    public String addAllDayEvent(LocalDate date) {
        String id = UUID.randomUUID().toString();
        allDayEvents.put(id, date);
        return id;
    }

    public Optional<CalendarEvent> find(String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    public int size() {
        return events.size() + allDayEvents.size();
    }
}

package com.ai.clinic.service;

import com.ai.clinic.calendar.CalendarClient;
import com.ai.clinic.calendar.CalendarEvent;
import com.ai.clinic.exception.SchedulingException;
import com.ai.clinic.time.SlotInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers whether a slot is free on the clinic calendar.
 * <p>
 * Only timed events block a slot; all-day entries are ignored. The check is a
 * plain read: nothing is reserved, so a concurrent booking can still take the
 * slot before the caller creates its event.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final CalendarClient calendarClient;

    public AvailabilityService(CalendarClient calendarClient) {
        this.calendarClient = calendarClient;
    }

    public boolean isFree(SlotInterval slot) {
        return isFree(slot, null);
    }

    /**
     * @param ignoredEventId event that never counts as a conflict, e.g. the one being moved
     */
    public boolean isFree(SlotInterval slot, String ignoredEventId) {
        List<CalendarEvent> events;
        try {
            events = calendarClient.listEvents(slot.start(), slot.end());
        } catch (SchedulingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw SchedulingException.calendarUnavailable("Could not reach the clinic calendar: " + e.getMessage(), e);
        }

        boolean free = events.stream()
                .filter(CalendarEvent::isTimed)
                .filter(e -> ignoredEventId == null || !ignoredEventId.equals(e.id()))
                .noneMatch(e -> slot.overlaps(e.start(), e.end()));
        log.debug("Slot {} - {} free={}", slot.start(), slot.end(), free);
        return free;
    }
}

package com.ai.clinic.service;

import com.ai.clinic.calendar.CalendarClient;
import com.ai.clinic.calendar.InMemoryCalendarClient;
import com.ai.clinic.exception.ErrorKind;
import com.ai.clinic.exception.SchedulingException;
import com.ai.clinic.time.SlotInterval;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AvailabilityServiceTest {

    private static final ZoneOffset IST = ZoneOffset.ofHoursMinutes(5, 30);

    private final InMemoryCalendarClient calendar = new InMemoryCalendarClient();
    private final AvailabilityService availability = new AvailabilityService(calendar);

    @Test
    void overlappingTimedEventBlocksSlot() {
        calendar.createEvent("Dental appointment - Checkup", "", at(10, 0), at(10, 30), "Asia/Kolkata");

        assertThat(availability.isFree(slot(10, 0))).isFalse();
        assertThat(availability.isFree(slot(9, 30))).isTrue();
        assertThat(availability.isFree(slot(10, 30))).isTrue();
    }

    @Test
    void partialOverlapBlocksSlot() {
        calendar.createEvent("Staff meeting", "", at(10, 15), at(11, 15), "Asia/Kolkata");

        assertThat(availability.isFree(slot(10, 0))).isFalse();
        assertThat(availability.isFree(slot(11, 0))).isFalse();
        assertThat(availability.isFree(slot(11, 30))).isTrue();
    }

    @Test
    void allDayEventsDoNotBlock() {
        calendar.addAllDayEvent(at(10, 0).toLocalDate());

        assertThat(availability.isFree(slot(10, 0))).isTrue();
    }

    @Test
    void ignoredEventDoesNotBlock() {
        String own = calendar.createEvent("Dental appointment - Cleaning", "", at(10, 0), at(10, 30), "Asia/Kolkata");

        assertThat(availability.isFree(slot(10, 0), own)).isTrue();
        assertThat(availability.isFree(slot(10, 0), "someone-else")).isFalse();
    }

    @Test
    void calendarFailureIsReportedAsUnavailableCalendar() {
        CalendarClient broken = mock(CalendarClient.class);
        when(broken.listEvents(any(), any())).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> new AvailabilityService(broken).isFree(slot(10, 0)))
                .isInstanceOfSatisfying(SchedulingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CALENDAR_UNAVAILABLE))
                .hasMessageContaining("connection reset");
    }

    @Test
    void schedulingExceptionPassesThroughUnchanged() {
        CalendarClient broken = mock(CalendarClient.class);
        SchedulingException failure = SchedulingException.calendarUnavailable("token refresh failed", null);
        when(broken.listEvents(any(), any())).thenThrow(failure);

        assertThatThrownBy(() -> new AvailabilityService(broken).isFree(slot(10, 0))).isSameAs(failure);
    }

    private static OffsetDateTime at(int hour, int minute) {
        return OffsetDateTime.of(2025, 8, 21, hour, minute, 0, 0, IST);
    }

    private static SlotInterval slot(int hour, int minute) {
        return SlotInterval.of(at(hour, minute), Duration.ofMinutes(30));
    }
}

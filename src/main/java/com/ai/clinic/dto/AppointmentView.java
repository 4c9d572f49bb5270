package com.ai.clinic.dto;

import com.ai.clinic.entity.StoredAppointment;
import com.ai.clinic.time.TemporalNormalizer;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public record AppointmentView(
        String id,
        String userId,
        String patientName,
        String reason,
        String date,
        String time,
        String startTime,
        String endTime,
        String calendarEventId,
        String status
) {
    public static AppointmentView from(StoredAppointment appointment, ZoneOffset offset) {
        OffsetDateTime start = appointment.getStartTime().atOffset(offset);
        OffsetDateTime end = appointment.getEndTime().atOffset(offset);
        return new AppointmentView(
                appointment.getId(),
                appointment.getUserId(),
                appointment.getPatientName(),
                appointment.getReason(),
                TemporalNormalizer.formatDate(start.toLocalDate()),
                TemporalNormalizer.formatTime(start.toLocalTime()),
                start.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                end.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                appointment.getCalendarEventId(),
                appointment.getStatus().name().toLowerCase(Locale.ROOT));
    }
}

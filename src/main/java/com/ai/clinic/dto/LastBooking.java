package com.ai.clinic.dto;

/**
 * The most recent booking or reschedule made within one conversation session.
 */
public record LastBooking(
        String appointmentId,
        String name,
        String date,
        String time,
        String reason,
        String phone,
        String email,
        String startTime,
        String endTime,
        String calendarEventId,
        String userId
) {
}

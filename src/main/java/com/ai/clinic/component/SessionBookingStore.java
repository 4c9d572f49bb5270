package com.ai.clinic.component;

import com.ai.clinic.dto.LastBooking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session "last booking" projection, kept in memory.
 */
@Component
public class SessionBookingStore {

    private static final Logger log = LoggerFactory.getLogger(SessionBookingStore.class);

    private final Map<String, LastBooking> bookings = new ConcurrentHashMap<>();

    public void record(String sessionId, LastBooking booking) {
        if (sessionId == null || booking == null) return;
        bookings.put(sessionId, booking);
        log.debug("[{}] Last booking -> {}", sessionId, booking.appointmentId());
    }

    public Optional<LastBooking> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(bookings.get(sessionId));
    }

    /** Drops the projection if it points at the given appointment. */
    public void forgetAppointment(String sessionId, String appointmentId) {
        if (sessionId == null || appointmentId == null) return;
        bookings.computeIfPresent(sessionId, (key, current) ->
                appointmentId.equals(current.appointmentId()) ? null : current);
    }

    public void clear(String sessionId) {
        if (sessionId != null) bookings.remove(sessionId);
    }
}

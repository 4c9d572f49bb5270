package com.ai.clinic.service;

import com.ai.clinic.entity.StoredAppointment;
import com.ai.clinic.repository.StoredAppointmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AppointmentService {

    private final StoredAppointmentRepository appointmentRepository;
    private final Clock clock;

    // =========================================================
    // ACTIVE APPOINTMENT
    // =========================================================

    /**
     * The soonest confirmed appointment starting now or later. Every
     * reschedule, cancel and lookup goes through here; other confirmed
     * future records for the same user are left alone.
     */
    @Transactional(readOnly = true)
    public Optional<StoredAppointment> findNearestUpcomingConfirmed(String userId) {
        Instant now = clock.instant();
        return appointmentRepository.findByUserId(userId).stream()
                .filter(a -> a.isUpcomingConfirmed(now))
                .min(Comparator.comparing(StoredAppointment::getStartTime));
    }

    // =========================================================
    // HISTORY
    // =========================================================
    @Transactional(readOnly = true)
    public List<StoredAppointment> listForUser(String userId, int limit) {
        int size = Math.max(1, Math.min(limit, 200));
        return appointmentRepository.findByUserIdOrderByStartTimeAsc(userId, PageRequest.of(0, size));
    }

    @Transactional
    public StoredAppointment save(StoredAppointment appointment) {
        return appointmentRepository.save(appointment);
    }
}

package com.ai.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "stored_appointment", indexes = {
    @Index(name = "idx_stored_appointment_user_id", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoredAppointment {

    public enum Status { CONFIRMED, CANCELLED }

    @Id
    @Column(length = 36, updatable = false)
    @Setter(AccessLevel.NONE)
    private String id;

    /** Owner's email, the lookup key shared with {@link UserProfile}. */
    @Column(name = "user_id", nullable = false, length = 254)
    private String userId;

    @Column(name = "patient_name", nullable = false, length = 100)
    private String patientName;

    @Column(length = 255)
    private String reason;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "calendar_event_id", length = 255)
    private String calendarEventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.CONFIRMED;

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isConfirmed() {
        return status == Status.CONFIRMED;
    }

    public boolean isUpcomingConfirmed(Instant now) {
        return isConfirmed() && startTime != null && !startTime.isBefore(now);
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

package com.ai.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "user_profile")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile {

    /** Lower-cased email. */
    @Id
    @Column(name = "user_id", length = 254, updatable = false)
    @Setter(AccessLevel.NONE)
    private String userId;

    @Column(length = 100)
    private String name;

    @Column(length = 254)
    private String email;

    @Column(length = 20)
    private String phone;

    @Embedded
    @Builder.Default
    private UserPreferences preferences = new UserPreferences();

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Hibernate hands back null for an embedded value whose columns are all null
    public UserPreferences getPreferences() {
        if (preferences == null) {
            preferences = new UserPreferences();
        }
        return preferences;
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

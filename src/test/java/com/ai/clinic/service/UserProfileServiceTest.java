package com.ai.clinic.service;

import com.ai.clinic.dto.PreferencesPatch;
import com.ai.clinic.entity.UserProfile;
import com.ai.clinic.repository.UserProfileRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UserProfileServiceTest {

    private static final Instant NOW = Instant.parse("2025-08-20T04:30:00Z");

    private final UserProfileRepository repository = mock(UserProfileRepository.class);
    private final UserProfileService service = new UserProfileService(repository, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void firstBookingCreatesProfile() {
        when(repository.findById("asha@example.com")).thenReturn(Optional.empty());
        when(repository.save(any(UserProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        UserProfile saved = service.recordBooking("asha@example.com", "Asha Rao", "9876543210",
                PreferencesPatch.builder().insuranceProvider("  Star Health ").build());

        assertThat(saved.getUserId()).isEqualTo("asha@example.com");
        assertThat(saved.getEmail()).isEqualTo("asha@example.com");
        assertThat(saved.getName()).isEqualTo("Asha Rao");
        assertThat(saved.getPreferences().getInsuranceProvider()).isEqualTo("Star Health");
        assertThat(saved.getPreferences().getLastUpdated()).isEqualTo(NOW);
    }

    @Test
    void laterBookingKeepsUnmentionedPreferences() {
        UserProfile existing = UserProfile.builder().userId("asha@example.com").email("asha@example.com").build();
        existing.getPreferences().setPreferredDentist("Dr. Mehta");
        existing.getPreferences().setPreferredTimes(List.of("morning"));
        when(repository.findById("asha@example.com")).thenReturn(Optional.of(existing));
        when(repository.save(any(UserProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        UserProfile saved = service.recordBooking("asha@example.com", "Asha R.", null,
                PreferencesPatch.builder().dentalAnxiety(true).build());

        assertThat(saved.getName()).isEqualTo("Asha R.");
        assertThat(saved.getPreferences().asMap())
                .containsEntry("preferred_dentist", "Dr. Mehta")
                .containsEntry("preferred_times", List.of("morning"))
                .containsEntry("dental_anxiety", true);
    }

    @Test
    void updateWithoutProfileReturnsEmpty() {
        when(repository.findById("nobody@example.com")).thenReturn(Optional.empty());

        assertThat(service.updatePreferences("nobody@example.com", PreferencesPatch.builder().tone("calm").build()))
                .isEmpty();
        verify(repository, never()).save(any());
    }

    @Test
    void updateReplacesOnlyProvidedFields() {
        UserProfile existing = UserProfile.builder().userId("asha@example.com").build();
        existing.getPreferences().setTone("formal");
        existing.getPreferences().setPrefersEmojis(true);
        when(repository.findById("asha@example.com")).thenReturn(Optional.of(existing));
        when(repository.save(any(UserProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        Optional<UserProfile> updated = service.updatePreferences("asha@example.com",
                PreferencesPatch.builder().tone(" Casual ").prefersBriefResponses(true).build());

        assertThat(updated).hasValueSatisfying(p -> assertThat(p.getPreferences().asMap())
                .containsEntry("tone", "casual")
                .containsEntry("prefers_emojis", true)
                .containsEntry("prefers_brief_responses", true));
    }
}

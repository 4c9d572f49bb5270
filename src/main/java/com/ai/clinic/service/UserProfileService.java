package com.ai.clinic.service;

import com.ai.clinic.dto.PreferencesPatch;
import com.ai.clinic.entity.UserProfile;
import com.ai.clinic.repository.UserProfileRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Patient profiles and their preference bag. Updates are partial merges:
 * a field that isn't provided keeps its stored value.
 */
@Service
public class UserProfileService {

    private static final Logger log = LoggerFactory.getLogger(UserProfileService.class);

    private final UserProfileRepository profileRepository;
    private final Clock clock;

    public UserProfileService(UserProfileRepository profileRepository, Clock clock) {
        this.profileRepository = profileRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<UserProfile> find(String userId) {
        return profileRepository.findById(userId);
    }

    /**
     * Creates the profile on first booking, otherwise refreshes name/phone and
     * merges whatever preferences came with the booking.
     */
    @Transactional
    public UserProfile recordBooking(String userId, String name, String phone, PreferencesPatch preferences) {
        UserProfile profile = profileRepository.findById(userId)
                .orElseGet(() -> UserProfile.builder()
                        .userId(userId)
                        .email(userId)
                        .build());

        if (StringUtils.isNotBlank(name)) profile.setName(name);
        if (StringUtils.isNotBlank(phone)) profile.setPhone(phone);
        profile.getPreferences().merge(clean(preferences), clock.instant());

        UserProfile saved = profileRepository.save(profile);
        log.info("Saved profile for {}", userId);
        return saved;
    }

    /** @return the updated profile, or empty if none exists yet */
    @Transactional
    public Optional<UserProfile> updatePreferences(String userId, PreferencesPatch patch) {
        Optional<UserProfile> existing = profileRepository.findById(userId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        UserProfile profile = existing.get();
        if (profile.getPreferences().merge(clean(patch), clock.instant())) {
            profile = profileRepository.save(profile);
            log.info("Updated preferences for {}", userId);
        }
        return Optional.of(profile);
    }

    private static PreferencesPatch clean(PreferencesPatch patch) {
        if (patch == null) return null;
        List<String> times = patch.getPreferredTimes() == null ? null
                : patch.getPreferredTimes().stream().filter(StringUtils::isNotBlank).map(String::trim).toList();
        return PreferencesPatch.builder()
                .email(patch.getEmail())
                .preferredTimes(times)
                .preferredDentist(StringUtils.trimToNull(patch.getPreferredDentist()))
                .insuranceProvider(StringUtils.trimToNull(patch.getInsuranceProvider()))
                .dentalAnxiety(patch.getDentalAnxiety())
                .prefersBriefResponses(patch.getPrefersBriefResponses())
                .prefersEmojis(patch.getPrefersEmojis())
                .tone(patch.getTone() == null ? null : StringUtils.trimToNull(patch.getTone().toLowerCase(Locale.ROOT)))
                .build();
    }
}

package com.ai.clinic.entity;

import com.ai.clinic.dto.PreferencesPatch;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-lived personalization for a patient. Only fields present in a
 * {@link PreferencesPatch} are ever overwritten.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPreferences {

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_times", length = 500)
    @Builder.Default
    private List<String> preferredTimes = new ArrayList<>();

    @Column(name = "preferred_dentist", length = 100)
    private String preferredDentist;

    @Column(name = "insurance_provider", length = 100)
    private String insuranceProvider;

    @Column(name = "dental_anxiety")
    private Boolean dentalAnxiety;

    @Column(name = "prefers_brief_responses")
    private Boolean prefersBriefResponses;

    @Column(name = "prefers_emojis")
    private Boolean prefersEmojis;

    @Column(length = 20)
    private String tone;

    @Column(name = "preferences_updated_at")
    private Instant lastUpdated;

    /**
     * Applies the provided fields of the patch.
     *
     * @return true if at least one field was provided
     */
    public boolean merge(PreferencesPatch patch, Instant now) {
        if (patch == null || !patch.hasChanges()) {
            return false;
        }
        if (patch.getPreferredTimes() != null) {
            preferredTimes = new ArrayList<>(patch.getPreferredTimes());
        }
        if (patch.getPreferredDentist() != null) {
            preferredDentist = patch.getPreferredDentist();
        }
        if (patch.getInsuranceProvider() != null) {
            insuranceProvider = patch.getInsuranceProvider();
        }
        if (patch.getDentalAnxiety() != null) {
            dentalAnxiety = patch.getDentalAnxiety();
        }
        if (patch.getPrefersBriefResponses() != null) {
            prefersBriefResponses = patch.getPrefersBriefResponses();
        }
        if (patch.getPrefersEmojis() != null) {
            prefersEmojis = patch.getPrefersEmojis();
        }
        if (patch.getTone() != null) {
            tone = patch.getTone();
        }
        lastUpdated = now;
        return true;
    }

    public boolean isEmpty() {
        return asMap().isEmpty();
    }

    /** Set fields only, in a stable order. */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (preferredTimes != null && !preferredTimes.isEmpty()) map.put("preferred_times", List.copyOf(preferredTimes));
        if (preferredDentist != null) map.put("preferred_dentist", preferredDentist);
        if (insuranceProvider != null) map.put("insurance_provider", insuranceProvider);
        if (dentalAnxiety != null) map.put("dental_anxiety", dentalAnxiety);
        if (prefersBriefResponses != null) map.put("prefers_brief_responses", prefersBriefResponses);
        if (prefersEmojis != null) map.put("prefers_emojis", prefersEmojis);
        if (tone != null) map.put("tone", tone);
        return map;
    }
}

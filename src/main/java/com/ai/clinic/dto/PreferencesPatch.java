package com.ai.clinic.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial preference update. A null field means "not provided" and leaves the
 * stored value alone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferencesPatch {

    @JsonAlias({"contact_email", "contactEmail", "user_id"})
    private String email;

    @JsonAlias("preferred_times")
    private List<String> preferredTimes;

    @JsonAlias("preferred_dentist")
    private String preferredDentist;

    @JsonAlias("insurance_provider")
    private String insuranceProvider;

    @JsonAlias("dental_anxiety")
    private Boolean dentalAnxiety;

    @JsonAlias("prefers_brief_responses")
    private Boolean prefersBriefResponses;

    @JsonAlias("prefers_emojis")
    private Boolean prefersEmojis;

    private String tone;

    public boolean hasChanges() {
        return preferredTimes != null
                || preferredDentist != null
                || insuranceProvider != null
                || dentalAnxiety != null
                || prefersBriefResponses != null
                || prefersEmojis != null
                || tone != null;
    }
}

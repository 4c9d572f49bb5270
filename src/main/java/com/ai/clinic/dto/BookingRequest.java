package com.ai.clinic.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Booking details as extracted from the conversation. Date and time are raw text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {

    @JsonAlias("patient_name")
    private String name;

    @JsonAlias({"preferred_date", "preferredDate"})
    private String date;

    private String time;

    private String reason;

    @JsonAlias({"contact_email", "contactEmail"})
    private String email;

    @JsonAlias({"contact_phone", "contactPhone"})
    private String phone;

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

    public PreferencesPatch toPreferencesPatch() {
        return PreferencesPatch.builder()
                .email(email)
                .preferredTimes(preferredTimes)
                .preferredDentist(preferredDentist)
                .insuranceProvider(insuranceProvider)
                .dentalAnxiety(dentalAnxiety)
                .prefersBriefResponses(prefersBriefResponses)
                .prefersEmojis(prefersEmojis)
                .tone(tone)
                .build();
    }
}

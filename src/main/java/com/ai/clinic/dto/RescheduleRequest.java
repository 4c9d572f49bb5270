package com.ai.clinic.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleRequest {

    @JsonAlias({"contact_email", "contactEmail"})
    private String email;

    @JsonAlias({"new_preferred_date", "newPreferredDate", "new_date"})
    private String newDate;

    @JsonAlias("new_time")
    private String newTime;
}

package com.ai.clinic.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotCheckRequest {

    @JsonAlias({"preferred_date", "preferredDate"})
    private String date;

    private String time;
}

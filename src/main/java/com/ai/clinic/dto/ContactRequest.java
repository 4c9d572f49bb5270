package com.ai.clinic.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Identifies a patient by the email used at booking. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContactRequest {

    @JsonAlias({"contact_email", "contactEmail", "user_id"})
    private String email;
}

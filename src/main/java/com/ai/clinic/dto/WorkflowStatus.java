package com.ai.clinic.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowStatus {
    CONFIRMED("confirmed"),
    AVAILABLE("available"),
    UNAVAILABLE("unavailable"),
    OUTSIDE_HOURS("outside_hours"),
    RESCHEDULED("rescheduled"),
    CANCELLED("cancelled"),
    FOUND("found"),
    NOT_FOUND("not_found"),
    NO_PREFERENCES("no_preferences"),
    UPDATED("updated"),
    WARN("warn"),
    BLOCKED("blocked"),
    RESET("reset"),
    INVALID("invalid"),
    ERROR("error");

    private final String wireName;

    WorkflowStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

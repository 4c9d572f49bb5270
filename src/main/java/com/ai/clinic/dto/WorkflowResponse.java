package com.ai.clinic.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one workflow operation: a status, a complete user-facing
 * sentence the caller relays verbatim, and an optional payload that is
 * flattened into the JSON object next to them.
 */
public final class WorkflowResponse {

    public static final String ALTERNATIVES = "alternatives";
    public static final String APPOINTMENT = "appointment";
    public static final String PREFERENCES = "preferences";
    public static final String VIOLATIONS = "violations";

    private final WorkflowStatus status;
    private final String message;
    private final Map<String, Object> payload;
    private final List<SlotView> alternatives;

    private WorkflowResponse(WorkflowStatus status, String message, Map<String, Object> payload) {
        this(status, message, payload, List.of());
    }

    private WorkflowResponse(WorkflowStatus status, String message, Map<String, Object> payload,
                             List<SlotView> alternatives) {
        this.status = status;
        this.message = message;
        this.payload = payload == null ? Collections.emptyMap() : new LinkedHashMap<>(payload);
        this.alternatives = alternatives;
    }

    @JsonProperty("status")
    public WorkflowStatus getStatus() {
        return status;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonAnyGetter
    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public Object get(String key) {
        return payload.get(key);
    }

    @JsonIgnore
    public List<SlotView> getAlternatives() {
        return alternatives;
    }

    public static WorkflowResponse of(WorkflowStatus status, String message) {
        return new WorkflowResponse(status, message, null);
    }

    public static WorkflowResponse of(WorkflowStatus status, String message, Map<String, Object> payload) {
        return new WorkflowResponse(status, message, payload);
    }

    public static WorkflowResponse unavailable(String message, List<SlotView> alternatives) {
        List<SlotView> slots = List.copyOf(alternatives);
        return new WorkflowResponse(WorkflowStatus.UNAVAILABLE, message, Map.of(ALTERNATIVES, slots), slots);
    }

    public static WorkflowResponse invalid(String message) {
        return new WorkflowResponse(WorkflowStatus.INVALID, message, null);
    }

    public static WorkflowResponse error(String message) {
        return new WorkflowResponse(WorkflowStatus.ERROR, message, null);
    }

    @Override
    public String toString() {
        return "WorkflowResponse{status=" + status + ", message='" + message + "', payload=" + payload.keySet() + "}";
    }
}

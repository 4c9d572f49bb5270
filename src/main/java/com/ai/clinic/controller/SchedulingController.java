package com.ai.clinic.controller;

import com.ai.clinic.dto.AppointmentView;
import com.ai.clinic.dto.WorkflowResponse;
import com.ai.clinic.service.AppointmentService;
import com.ai.clinic.service.ContactValidator;
import com.ai.clinic.service.ToolDispatcher;
import com.ai.clinic.time.TemporalNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SchedulingController {

    private final ToolDispatcher dispatcher;
    private final AppointmentService appointmentService;
    private final ContactValidator contactValidator;
    private final TemporalNormalizer normalizer;

    public SchedulingController(ToolDispatcher dispatcher,
                                AppointmentService appointmentService,
                                ContactValidator contactValidator,
                                TemporalNormalizer normalizer) {
        this.dispatcher = dispatcher;
        this.appointmentService = appointmentService;
        this.contactValidator = contactValidator;
        this.normalizer = normalizer;
    }

    /**
     * Runs one tool call. Outcomes, including rejected input, come back as
     * 200 with a status field; only malformed HTTP requests map to 4xx.
     */
    @PostMapping("/sessions/{sessionId}/tools/{operation}")
    public ResponseEntity<WorkflowResponse> invoke(@PathVariable String sessionId,
                                                   @PathVariable String operation,
                                                   @RequestBody(required = false) JsonNode args) {
        return ResponseEntity.ok(dispatcher.dispatch(sessionId, operation, args));
    }

    @GetMapping("/sessions/{sessionId}/appointment")
    public ResponseEntity<WorkflowResponse> lastBooking(@PathVariable String sessionId) {
        return ResponseEntity.ok(dispatcher.lastBooking(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/reset")
    public ResponseEntity<WorkflowResponse> reset(@PathVariable String sessionId) {
        return ResponseEntity.ok(dispatcher.resetSession(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> end(@PathVariable String sessionId) {
        dispatcher.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/appointments")
    public List<AppointmentView> appointments(@RequestParam String userId,
                                              @RequestParam(defaultValue = "50") int limit) {
        String normalized = contactValidator.normalizeEmail(userId);
        return appointmentService.listForUser(normalized, limit).stream()
                .map(a -> AppointmentView.from(a, normalizer.offset()))
                .toList();
    }
}

package com.ai.clinic.service;

import com.ai.clinic.component.ResponsePhrases;
import com.ai.clinic.component.SessionBookingStore;
import com.ai.clinic.dto.BookingRequest;
import com.ai.clinic.dto.ContactRequest;
import com.ai.clinic.dto.LastBooking;
import com.ai.clinic.dto.PreferencesPatch;
import com.ai.clinic.dto.RescheduleRequest;
import com.ai.clinic.dto.SlotCheckRequest;
import com.ai.clinic.dto.ToolOperation;
import com.ai.clinic.dto.WorkflowResponse;
import com.ai.clinic.dto.WorkflowStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for tool calls coming from the conversational front end.
 * Resolves the operation by name, binds its arguments and applies the
 * session lock before handing over to {@link BookingWorkflowService}.
 */
@Service
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final BookingWorkflowService workflow;
    private final ModerationGuardService moderation;
    private final SessionBookingStore sessionBookingStore;
    private final ResponsePhrases phrases;
    private final ObjectMapper objectMapper;

    public ToolDispatcher(BookingWorkflowService workflow,
                          ModerationGuardService moderation,
                          SessionBookingStore sessionBookingStore,
                          ResponsePhrases phrases,
                          ObjectMapper objectMapper) {
        this.workflow = workflow;
        this.moderation = moderation;
        this.sessionBookingStore = sessionBookingStore;
        this.phrases = phrases;
        this.objectMapper = objectMapper;
    }

    public WorkflowResponse dispatch(String sessionId, String operationName, JsonNode args) {
        Optional<ToolOperation> operationOpt = ToolOperation.fromWireName(operationName);
        if (operationOpt.isEmpty()) {
            log.warn("[{}] Unknown operation '{}'", sessionId, operationName);
            return WorkflowResponse.invalid(phrases.unknownOperation(operationName));
        }
        ToolOperation operation = operationOpt.get();

        if (operation != ToolOperation.MODERATION_GUARD && moderation.isBlocked(sessionId)) {
            log.info("[{}] Refusing {} on locked session", sessionId, operation.wireName());
            return moderation.blockedResponse();
        }

        JsonNode body = args == null || args.isNull() ? JsonNodeFactory.instance.objectNode() : args;
        log.debug("[{}] {} <- {}", sessionId, operation.wireName(), body);

        try {
            WorkflowResponse response = switch (operation) {
                case BOOK -> workflow.book(sessionId, bind(body, BookingRequest.class));
                case RESCHEDULE -> workflow.reschedule(sessionId, bind(body, RescheduleRequest.class));
                case CANCEL -> workflow.cancel(sessionId, bind(body, ContactRequest.class));
                case LOOKUP -> workflow.lookup(bind(body, ContactRequest.class));
                case CHECK_SLOT -> workflow.checkSlot(bind(body, SlotCheckRequest.class));
                case UPDATE_PREFERENCES -> workflow.updatePreferences(bind(body, PreferencesPatch.class));
                case GET_PREFERENCES -> workflow.getPreferences(bind(body, ContactRequest.class));
                case MODERATION_GUARD -> moderation.recordViolation(sessionId);
            };
            log.info("[{}] {} -> {}", sessionId, operation.wireName(), response.getStatus().wireName());
            return response;
        } catch (JsonProcessingException e) {
            log.warn("[{}] Unreadable arguments for {}: {}", sessionId, operation.wireName(), e.getOriginalMessage());
            return WorkflowResponse.invalid("I couldn't read the details for " + operation.wireName()
                    + ". Could you repeat them?");
        }
    }

    public WorkflowResponse lastBooking(String sessionId) {
        return sessionBookingStore.find(sessionId)
                .map(this::lastBookingResponse)
                .orElseGet(() -> WorkflowResponse.of(WorkflowStatus.NOT_FOUND, phrases.noBookingInSession()));
    }

    public WorkflowResponse resetSession(String sessionId) {
        forget(sessionId);
        log.info("[{}] Session reset", sessionId);
        return WorkflowResponse.of(WorkflowStatus.RESET, phrases.sessionReset());
    }

    /** Called when the conversation is over; drops everything held for the session. */
    public void endSession(String sessionId) {
        forget(sessionId);
        log.info("[{}] Session ended", sessionId);
    }

    private void forget(String sessionId) {
        sessionBookingStore.clear(sessionId);
        moderation.reset(sessionId);
    }

    private WorkflowResponse lastBookingResponse(LastBooking booking) {
        return WorkflowResponse.of(WorkflowStatus.FOUND,
                phrases.lastBooking(booking.name(), booking.date(), booking.time()),
                Map.of(WorkflowResponse.APPOINTMENT, booking));
    }

    private <T> T bind(JsonNode body, Class<T> type) throws JsonProcessingException {
        return objectMapper.treeToValue(body, type);
    }
}

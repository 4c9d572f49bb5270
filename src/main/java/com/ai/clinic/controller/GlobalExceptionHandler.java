package com.ai.clinic.controller;

import com.ai.clinic.dto.WorkflowResponse;
import com.ai.clinic.exception.SchedulingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps errors that escape the workflow layer onto the same
 * {status, message} envelope the tool calls use.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<WorkflowResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(WorkflowResponse.invalid("The request body is not valid JSON."));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<WorkflowResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing request parameter: {}", ex.getParameterName());
        return ResponseEntity.badRequest()
                .body(WorkflowResponse.invalid("Missing required parameter '" + ex.getParameterName() + "'."));
    }

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<WorkflowResponse> handleScheduling(SchedulingException ex) {
        if (ex.getKind().isValidation()) {
            log.warn("Rejected request: {} ({})", ex.getMessage(), ex.getKind());
            return ResponseEntity.badRequest().body(WorkflowResponse.invalid(ex.getMessage()));
        }
        log.error("Scheduling failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(WorkflowResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<WorkflowResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(WorkflowResponse.error("An unexpected error occurred"));
    }
}

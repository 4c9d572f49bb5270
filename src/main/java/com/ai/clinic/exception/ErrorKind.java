package com.ai.clinic.exception;

/**
 * Classifies failures raised inside the scheduling core.
 */
public enum ErrorKind {
    INVALID_DATE,
    INVALID_TIME,
    INVALID_EMAIL,
    INVALID_PHONE,
    INVALID_REQUEST,
    CALENDAR_UNAVAILABLE;

    public boolean isValidation() {
        return this != CALENDAR_UNAVAILABLE;
    }
}

package com.ai.clinic.exception;

import lombok.Getter;

@Getter
public class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    public SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchedulingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static SchedulingException invalidDate(String message) {
        return new SchedulingException(ErrorKind.INVALID_DATE, message);
    }

    public static SchedulingException invalidTime(String message) {
        return new SchedulingException(ErrorKind.INVALID_TIME, message);
    }

    public static SchedulingException calendarUnavailable(String message, Throwable cause) {
        return new SchedulingException(ErrorKind.CALENDAR_UNAVAILABLE, message, cause);
    }
}

package com.ai.scheduler.exception;

import org.springframework.http.HttpStatus;

public class SchedulerException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public SchedulerException(HttpStatus status, String message, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public static SchedulerException badRequest(String message) {
        return new SchedulerException(HttpStatus.BAD_REQUEST, message, "bad_request");
    }

    public static SchedulerException sessionNotFound(String sessionId) {
        return new SchedulerException(HttpStatus.NOT_FOUND, "Unknown session: " + sessionId, "session_not_found");
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

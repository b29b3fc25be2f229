package com.mergington.activities.api.rest;

import com.mergington.activities.core.exception.ActivityNotFoundException;
import com.mergington.activities.core.exception.ActivityRegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps registry errors to {@code {"detail": ..., "code": ...}} responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(ActivityNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(ActivityNotFoundException e) {
        log.warn("Activity not found: {}", e.getActivityName());
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(ActivityRegistryException.class)
    public ResponseEntity<ErrorBody> handleRegistryError(ActivityRegistryException e) {
        log.warn("Request rejected: {} | {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleUnexpected(Exception e) throws Exception {
        if (e instanceof ErrorResponse) {
            // Framework errors (unknown route, wrong method) keep their own status
            throw e;
        }
        log.error("Unexpected failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", INTERNAL_ERROR);
    }

    private static ResponseEntity<ErrorBody> respond(HttpStatus status, String detail, String code) {
        return ResponseEntity.status(status).body(new ErrorBody(detail, code));
    }

    public record ErrorBody(String detail, String code) {}
}

package com.stepflow.api.rest;

import com.stepflow.core.exception.InvalidCronExpressionException;
import com.stepflow.core.exception.InvalidReplayTargetException;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.exception.StepflowException;
import com.stepflow.core.exception.WorkflowInactiveException;
import com.stepflow.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps domain exceptions to HTTP responses with a stable error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({
        InvalidStateTransitionException.class,
        InvalidReplayTargetException.class,
        WorkflowInactiveException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(StepflowException e) {
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({WorkflowValidationException.class, InvalidCronExpressionException.class})
    public ResponseEntity<ErrorResponse> handleInvalid(StepflowException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(StepflowException.class)
    public ResponseEntity<ErrorResponse> handleStepflow(StepflowException e) {
        log.error("Request failed with {}", e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error handling request", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, message, Instant.now()));
    }

    public record ErrorResponse(String errorCode, String message, Instant timestamp) {}
}

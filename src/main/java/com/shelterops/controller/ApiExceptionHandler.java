package com.shelterops.controller;

import com.shelterops.availability.MalformedTimeException;
import com.shelterops.dto.ErrorResponse;
import com.shelterops.exception.DependencyException;
import com.shelterops.exception.InvalidArgumentException;
import com.shelterops.exception.OrganizationNotFoundException;
import com.shelterops.exception.OrganizationPreconditionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to {success:false, code, message}. Empty availability is never an error.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(InvalidArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid-argument", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .findFirst()
                .orElse("Invalid request");
        log.warn("Rejected request: {}", message);
        return respond(HttpStatus.BAD_REQUEST, "invalid-argument", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid-argument", "Request body is malformed");
    }

    @ExceptionHandler(OrganizationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(OrganizationNotFoundException e) {
        log.warn("Organization lookup failed: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "not-found", e.getMessage());
    }

    @ExceptionHandler(OrganizationPreconditionException.class)
    public ResponseEntity<ErrorResponse> handlePrecondition(OrganizationPreconditionException e) {
        log.warn("Organization precondition failed: {}", e.getMessage());
        return respond(HttpStatus.PRECONDITION_FAILED, "failed-precondition", e.getMessage());
    }

    @ExceptionHandler(DependencyException.class)
    public ResponseEntity<ErrorResponse> handleDependency(DependencyException e) {
        log.error("External read failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", e.getMessage());
    }

    // stored schedule data that slipped past entry validation
    @ExceptionHandler(MalformedTimeException.class)
    public ResponseEntity<ErrorResponse> handleMalformedStoredTime(MalformedTimeException e) {
        log.error("Stored schedule data is malformed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled exception occurred", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Failed to calculate available time slots");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return new ResponseEntity<>(new ErrorResponse(code, message), status);
    }
}

package com.agentic.api.rest;

import com.agentic.core.exception.AgenticException;
import com.agentic.core.exception.NotFoundException;
import com.agentic.core.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps exceptions escaping the controllers to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    static final String BAD_REQUEST = "BAD_REQUEST";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        log.debug("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(AgenticException.class)
    public ResponseEntity<ErrorResponse> handleAgentic(AgenticException ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getErrorCode(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message, Instant.now()));
    }

    // ========== DTOs ==========

    public record ErrorResponse(
        String error,
        String message,
        Instant timestamp
    ) {}
}

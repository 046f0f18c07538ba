package com.example.regreport.controller;

import com.example.regreport.exception.AggregationAmbiguityException;
import com.example.regreport.exception.DataAbsenceException;
import com.example.regreport.exception.ReportPipelineException;
import com.example.regreport.exception.SchemaViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Global exception handler for REST controllers.
 * Provides consistent, structured JSON error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(ResponseStatusException e) {
        log.warn("Response status exception: {} - {}", e.getStatusCode(), e.getReason());
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        String errorCode = status.is4xxClientError() ? "CLIENT_ERROR" : "SERVER_ERROR";
        return Mono.just(buildResponse(e.getReason() != null ? e.getReason() : status.getReasonPhrase(), status, errorCode));
    }

    /**
     * Bad report dates and malformed mapping workbooks
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationError(IllegalArgumentException e) {
        log.warn("Validation error: {}", e.getMessage());
        return Mono.just(buildResponse("Validation failed: " + e.getMessage(), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR"));
    }

    @ExceptionHandler(DataAbsenceException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDataAbsence(DataAbsenceException e) {
        log.warn("Stale source data: {}", e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY, "DATA_ABSENT"));
    }

    @ExceptionHandler(SchemaViolationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSchemaViolation(SchemaViolationException e) {
        log.warn("Schema violation in {}: {}", e.getTable(), e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY, "SCHEMA_VIOLATION"));
    }

    @ExceptionHandler(AggregationAmbiguityException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAmbiguity(AggregationAmbiguityException e) {
        log.warn("Ambiguous attribute for tag {}: {}", e.getTag(), e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.CONFLICT, "AMBIGUOUS_ATTRIBUTE"));
    }

    @ExceptionHandler(ReportPipelineException.class)
    public Mono<ResponseEntity<ErrorResponse>> handlePipelineError(ReportPipelineException e) {
        log.error("Report pipeline error: {}", e.getMessage(), e);
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, "PIPELINE_ERROR"));
    }

    /**
     * Handle runtime exceptions (unexpected business errors)
     */
    @ExceptionHandler(RuntimeException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRuntimeException(RuntimeException e) {
        log.error("Runtime error: {}", e.getMessage(), e);
        return Mono.just(buildResponse(
                "An error occurred while processing your request: " + e.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR,
                "RUNTIME_ERROR"
        ));
    }

    /**
     * Handle generic exceptions (ultimate fallback)
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return Mono.just(buildResponse(
                "An unexpected error occurred. Please try again later.",
                HttpStatus.INTERNAL_SERVER_ERROR,
                "INTERNAL_ERROR"
        ));
    }

    private ResponseEntity<ErrorResponse> buildResponse(String message, HttpStatus status, String errorCode) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(false, message, errorCode, status.value(), Instant.now()));
    }

    /**
     * DTO for structured error response
     */
    public record ErrorResponse(
            boolean success,
            String error,
            String errorCode,
            int status,
            Instant timestamp
    ) {
    }
}

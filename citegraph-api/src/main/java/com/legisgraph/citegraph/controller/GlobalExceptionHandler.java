package com.legisgraph.citegraph.controller;

import com.legisgraph.citegraph.service.ingestion.IngestionException;
import com.legisgraph.citegraph.service.lineage.SectionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestionException(IngestionException exception) {
        if (!exception.isClientError()) {
            log.warn("Ingestion failed with {}: {}", exception.status().value(), exception.getMessage());
        }
        return ResponseEntity.status(exception.status())
                .body(Map.of("error", exception.getMessage()));
    }

    @ExceptionHandler(SectionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSectionNotFound(SectionNotFoundException exception) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of(
                        "error", exception.getMessage(),
                        "sectionId", exception.sectionId()
                ));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(WebExchangeBindException exception) {
        return invalidRequest(exception.getFieldErrors().stream()
                .map(this::describeField)
                .toList());
    }

    // List bodies are validated per element by the @Validated proxy or by handler method validation.
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException exception) {
        return invalidRequest(exception.getConstraintViolations().stream()
                .map(this::describeViolation)
                .sorted()
                .toList());
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleMethodValidation(HandlerMethodValidationException exception) {
        return invalidRequest(exception.getAllErrors().stream()
                .map(this::describeError)
                .toList());
    }

    private ResponseEntity<Map<String, Object>> invalidRequest(List<String> violations) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "Invalid request",
                        "violations", violations
                ));
    }

    private String describeField(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    private String describeViolation(ConstraintViolation<?> violation) {
        return violation.getPropertyPath() + " " + violation.getMessage();
    }

    private String describeError(MessageSourceResolvable error) {
        return error instanceof FieldError fieldError ? describeField(fieldError) : String.valueOf(error.getDefaultMessage());
    }
}

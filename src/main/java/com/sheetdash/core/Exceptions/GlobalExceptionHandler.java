package com.sheetdash.core.Exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SchemaValidationException.class)
    public ResponseEntity<Object> handleSchemaValidation(SchemaValidationException ex) {
        log.error("Schema validation failed: {}", ex.getMessage());
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Schema Error", ex.getMessage());
        body.put("details", ex.getMissing());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(TypeCoercionException.class)
    public ResponseEntity<Object> handleTypeCoercion(TypeCoercionException ex) {
        log.error("Type coercion failed: {}", ex.getMessage());
        Map<String, Object> body = body(HttpStatus.UNPROCESSABLE_ENTITY, "Type Coercion Error", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("row", ex.getRow());
        details.put("column", ex.getColumn());
        details.put("value", ex.getValue());
        body.put("details", details);
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<Object> handleAnalytics(AnalyticsException ex) {
        log.warn("Invalid analytics request: {}", ex.getMessage());
        return new ResponseEntity<>(body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({IOException.class, MaxUploadSizeExceededException.class})
    public ResponseEntity<Object> handleIOException(Exception ex) {
        log.error("File operation error: {}", ex.getMessage());
        return new ResponseEntity<>(body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception", ex);
        return new ResponseEntity<>(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred"), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}

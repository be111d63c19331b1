package com.gedcomtree.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(GedcomDomainException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(GedcomDomainException ex) {
        log.warn("Client error: {}", ex.getMessage());
        Map<String, Object> body = body("WRONG_RECORD_TYPE", ex.getMessage());
        body.put("requiredTag", ex.getRequiredTag());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(GedcomFormatViolationException.class)
    public ResponseEntity<Map<String, Object>> handleFormatViolation(GedcomFormatViolationException ex) {
        log.warn("Tree could not be parsed: {}", ex.getMessage());
        Map<String, Object> body = body("FORMAT_VIOLATION", ex.getMessage());
        body.put("lineNumber", ex.getLineNumber());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(TypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(TypeMismatchException ex) {
        return ResponseEntity.badRequest().body(body("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        // Spring MVC's own errors (missing parameter, unknown path) keep their status
        if (ex instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode()).body(body("REQUEST_ERROR", ex.getMessage()));
        }
        log.error("Unexpected error", ex);
        return ResponseEntity.internalServerError().body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}

package com.everon.link.controller.api;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.everon.link.exception.DuplicateRegistrationException;
import com.everon.link.exception.RegistrationNotFoundException;
import com.everon.link.exception.StoreConflictException;
import com.everon.link.exception.StoreUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps domain exceptions to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(RegistrationNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(RegistrationNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "REGISTRATION_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(DuplicateRegistrationException.class)
    public ResponseEntity<Map<String, String>> duplicate(DuplicateRegistrationException e) {
        return error(HttpStatus.CONFLICT, "REGISTRATION_EXISTS", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler({StoreUnavailableException.class, StoreConflictException.class})
    public ResponseEntity<Map<String, String>> storeUnavailable(RuntimeException e) {
        log.warn("Store error surfaced to API: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", "Registration store unavailable, retry later");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message, "code", code));
    }
}

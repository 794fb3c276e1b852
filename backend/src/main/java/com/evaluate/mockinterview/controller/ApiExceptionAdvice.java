package com.evaluate.mockinterview.controller;

import com.evaluate.mockinterview.exception.ExternalServiceUnavailableException;
import com.evaluate.mockinterview.exception.InvalidStateTransitionException;
import com.evaluate.mockinterview.exception.SessionNotFoundException;
import com.evaluate.mockinterview.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP statuses with a uniform JSON body.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "session_not_found", ex, request);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidStateTransitionException ex,
                                                                       HttpServletRequest request) {
        ResponseEntity<Map<String, Object>> response = respond(HttpStatus.CONFLICT, "invalid_state_transition", ex, request);
        response.getBody().put("current_status", ex.getCurrentStatus().name());
        response.getBody().put("event", ex.getEvent().name());
        return response;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", ex, request);
    }

    @ExceptionHandler(ExternalServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(ExternalServiceUnavailableException ex,
                                                                 HttpServletRequest request) {
        log.warn("{} {} failed, {} unavailable: {}", request.getMethod(), request.getRequestURI(), ex.getService(),
                ex.getMessage());
        ResponseEntity<Map<String, Object>> response =
                respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", ex, request);
        response.getBody().put("service", ex.getService());
        return response;
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, Exception ex,
                                                               HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", ex.getMessage());
        body.put("path", request.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}

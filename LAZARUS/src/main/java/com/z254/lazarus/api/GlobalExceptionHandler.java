package com.z254.lazarus.api;

import com.z254.lazarus.api.dto.ErrorResponse;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.domain.model.IllegalIncidentTransitionException;
import com.z254.lazarus.escalation.EscalationStateException;
import com.z254.lazarus.playbook.PlaybookValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.List;

/**
 * Maps domain exceptions raised by the API controllers to {@link ErrorResponse} bodies.
 * <ul>
 *     <li>Unknown ids: 404</li>
 *     <li>Invalid playbooks, requests and arguments: 400</li>
 *     <li>Illegal incident transitions and ticket state conflicts: 409</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, ServerHttpRequest request) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), request, null);
    }

    @ExceptionHandler(PlaybookValidationException.class)
    public ResponseEntity<ErrorResponse> handlePlaybookValidation(PlaybookValidationException ex,
                                                                  ServerHttpRequest request) {
        log.warn("Playbook rejected: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request, ex.getViolations());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBinding(WebExchangeBindException ex, ServerHttpRequest request) {
        List<String> violations = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return respond(HttpStatus.BAD_REQUEST, "Invalid request", request, violations);
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex, ServerHttpRequest request) {
        log.debug("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request, null);
    }

    @ExceptionHandler({IllegalIncidentTransitionException.class, EscalationStateException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException ex, ServerHttpRequest request) {
        log.info("Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), request, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, ServerHttpRequest request,
                                                  List<String> violations) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getPath().value())
                .timestamp(Instant.now())
                .violations(violations)
                .build());
    }
}

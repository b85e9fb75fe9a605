package com.forgeflow.exception;

import com.forgeflow.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.of(ex.getMessage(), "NOT_FOUND"));
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDuplicateResource(DuplicateResourceException ex) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.of(ex.getMessage(), "DUPLICATE"));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Rejected run transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.of(ex.getMessage(), "INVALID_TRANSITION"));
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAuthenticationFailed(AuthenticationFailedException ex) {
        log.warn("Authentication failed: {}", ex.getFailure());
        return respond(HttpStatus.UNAUTHORIZED, ErrorResponse.of(ex.getMessage(), ex.getFailure().name()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Database not available", ex.getCause());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.of(ex.getMessage(), "STORE_UNAVAILABLE"));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("Validation failed: " + errors, "VALIDATION_FAILED"));
    }

    /**
     * Unreadable bodies, unconvertible path or query values and missing parameters.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleServerWebInput(ServerWebInputException ex) {
        log.warn("Rejected request input: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("Invalid request: " + ex.getReason(), "VALIDATION_FAILED"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request rejected with {}: {}", ex.getStatusCode(), ex.getReason());
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        String code = status != null ? status.name() : "HTTP_" + ex.getStatusCode().value();
        String detail = ex.getReason() != null ? ex.getReason() : code;
        return respond(ex.getStatusCode(), ErrorResponse.of(detail, code));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of("Internal server error", "INTERNAL_ERROR"));
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatusCode status, ErrorResponse body) {
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}

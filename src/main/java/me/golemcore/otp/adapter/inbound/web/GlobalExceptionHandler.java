package me.golemcore.otp.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.otp.domain.exception.ConversionException;
import me.golemcore.otp.domain.exception.DuplicateEntryException;
import me.golemcore.otp.domain.exception.EmptyModificationException;
import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.exception.PasswordMismatchException;
import me.golemcore.otp.domain.exception.TokenSyncException;
import me.golemcore.otp.domain.exception.TokenValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the token API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.otp.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TokenValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleValidation(TokenValidationException ex) {
        return badRequest(ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(PasswordMismatchException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handlePasswordMismatch(PasswordMismatchException ex) {
        return badRequest(ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(ConversionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConversion(ConversionException ex) {
        return badRequest(ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(EmptyModificationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleEmptyModification(EmptyModificationException ex) {
        return badRequest(ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        return badRequest(ex.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(DuplicateEntryException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleDuplicate(DuplicateEntryException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(TokenSyncException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSync(TokenSyncException ex) {
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        return error(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    private Mono<ResponseEntity<ApiErrorResponse>> badRequest(String message, String field) {
        log.warn("[API] Bad request: {}", message);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(message)
                .field(field)
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    private Mono<ResponseEntity<ApiErrorResponse>> error(HttpStatus status, String message) {
        log.warn("[API] {}: {}", status, message);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}

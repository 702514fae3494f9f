package me.golemcore.otp.adapter.inbound.web;

import me.golemcore.otp.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.otp.domain.exception.ConversionException;
import me.golemcore.otp.domain.exception.DuplicateEntryException;
import me.golemcore.otp.domain.exception.EmptyModificationException;
import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.exception.PasswordMismatchException;
import me.golemcore.otp.domain.exception.TokenSyncException;
import me.golemcore.otp.domain.exception.TokenValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleValidationWithField() {
        TokenValidationException ex = new TokenValidationException("digits", "must be one of: 6, 8");

        StepVerifier.create(handler.handleValidation(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("invalid 'digits': must be one of: 6, 8", body.getMessage());
                    assertEquals("digits", body.getField());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleKeyErrorsAsBadRequest() {
        StepVerifier.create(handler.handlePasswordMismatch(new PasswordMismatchException("key")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("key: Passwords do not match", response.getBody().getMessage());
                })
                .verifyComplete();

        StepVerifier.create(handler.handleConversion(new ConversionException("key", "Non-base32 digit found", null)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("key", response.getBody().getField());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleEmptyModification() {
        StepVerifier.create(handler.handleEmptyModification(new EmptyModificationException()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertNull(response.getBody().getField());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleNotFound() {
        StepVerifier.create(handler.handleNotFound(NotFoundException.token("abc")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("abc: OTP token not found", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleDuplicateAsConflict() {
        StepVerifier.create(handler.handleDuplicate(new DuplicateEntryException("abc")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHandleSyncFailureAsBadGateway() {
        TokenSyncException ex = new TokenSyncException("Failed to contact sync endpoint", new IOException("refused"));

        StepVerifier.create(handler.handleSync(ex))
                .assertNext(response -> assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Use JSON");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNSUPPORTED_MEDIA_TYPE, response.getStatusCode());
                    assertEquals("Use JSON", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("disk on fire")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}

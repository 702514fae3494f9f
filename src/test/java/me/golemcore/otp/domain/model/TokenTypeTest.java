package me.golemcore.otp.domain.model;

import me.golemcore.otp.domain.exception.TokenValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TokenTypeTest {

    @Test
    void shouldParseTypeCaseInsensitively() {
        assertEquals(TokenType.TOTP, TokenType.fromValue("totp"));
        assertEquals(TokenType.HOTP, TokenType.fromValue(" HOTP "));
    }

    @Test
    void shouldRejectUnknownType() {
        TokenValidationException ex = assertThrows(TokenValidationException.class,
                () -> TokenType.fromValue("sms"));
        assertEquals("type", ex.getField());
        assertEquals("must be one of: totp, hotp", ex.getError());
    }

    @Test
    void shouldExposeSchemaClassMarker() {
        assertEquals("otptokentotp", TokenType.TOTP.getObjectClass());
        assertEquals("otptokenhotp", TokenType.HOTP.getObjectClass());
    }

    @Test
    void shouldDeriveTypeFromObjectClasses() {
        assertEquals(Optional.of(TokenType.HOTP),
                TokenType.fromObjectClasses(List.of("top", "otptoken", "OTPTokenHOTP")));
        assertEquals(Optional.empty(), TokenType.fromObjectClasses(List.of("otptoken")));
        assertEquals(Optional.empty(), TokenType.fromObjectClasses(null));
    }

    @Test
    void shouldDefaultAlgorithmAndRejectUnknown() {
        assertEquals(TokenAlgorithm.SHA1, TokenAlgorithm.fromValue(null));
        assertEquals(TokenAlgorithm.SHA256, TokenAlgorithm.fromValue("sha256"));
        TokenValidationException ex = assertThrows(TokenValidationException.class,
                () -> TokenAlgorithm.fromValue("md5"));
        assertEquals("algorithm", ex.getField());
    }

    @Test
    void shouldValidateTypeParameters() {
        assertEquals(new TotpParameters(0, 30), TotpParameters.of(null, null));
        assertEquals(new HotpParameters(0), HotpParameters.of(null));
        assertEquals("timeStep",
                assertThrows(TokenValidationException.class, () -> TotpParameters.of(0, 4)).getField());
        assertEquals("counter",
                assertThrows(TokenValidationException.class, () -> HotpParameters.of(-1L)).getField());
    }
}

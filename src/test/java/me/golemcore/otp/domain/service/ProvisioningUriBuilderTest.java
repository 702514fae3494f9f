package me.golemcore.otp.domain.service;

import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.model.HotpParameters;
import me.golemcore.otp.domain.model.OtpToken;
import me.golemcore.otp.domain.model.TokenAlgorithm;
import me.golemcore.otp.domain.model.TokenParameters;
import me.golemcore.otp.domain.model.TotpParameters;
import me.golemcore.otp.infrastructure.config.OtpProperties;
import me.golemcore.otp.port.outbound.IdentityPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProvisioningUriBuilderTest {

    private static final String ALICE_REF = "uid=alice,cn=users,cn=accounts,dc=example,dc=com";
    private static final String ZERO_SECRET = "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA";

    private IdentityPort identityPort;
    private ProvisioningUriBuilder builder;

    @BeforeEach
    void setUp() {
        identityPort = mock(IdentityPort.class);
        OtpProperties properties = new OtpProperties();
        builder = new ProvisioningUriBuilder(identityPort, new TokenKeyCodec(), properties);
    }

    @Test
    void shouldBuildDeterministicTotpUri() {
        OtpToken token = token("abc", TotpParameters.of(null, 30));

        String uri = builder.build(token, "EXAMPLE.COM");

        assertEquals("otpauth://totp/EXAMPLE.COM:abc?issuer=EXAMPLE.COM&secret=" + ZERO_SECRET
                + "&digits=6&algorithm=SHA1&period=30", uri);
    }

    @Test
    void shouldUseCounterForHotp() {
        OtpToken token = token("abc", HotpParameters.of(5L));
        token.setAlgorithm(TokenAlgorithm.SHA256);
        token.setDigits(8);

        String uri = builder.build(token, "EXAMPLE.COM");

        assertEquals("otpauth://hotp/EXAMPLE.COM:abc?issuer=EXAMPLE.COM&secret=" + ZERO_SECRET
                + "&digits=8&algorithm=SHA256&counter=5", uri);
    }

    @Test
    void shouldFallBackToRealmWithoutOwner() {
        String uri = builder.build(token("abc", TotpParameters.of(null, null)));

        assertTrue(uri.startsWith("otpauth://totp/EXAMPLE.COM:abc?issuer=EXAMPLE.COM&"));
        verify(identityPort, never()).lookupAttribute(anyString(), anyString());
    }

    @Test
    void shouldUseOwnerPrincipalAsIssuer() {
        when(identityPort.lookupAttribute(ALICE_REF, "principalname")).thenReturn(Optional.of("alice@EXAMPLE.COM"));
        OtpToken token = token("abc", TotpParameters.of(null, null));
        token.setOwner(ALICE_REF);

        String uri = builder.build(token);

        assertTrue(uri.startsWith("otpauth://totp/alice@EXAMPLE.COM:abc?issuer=alice%40EXAMPLE.COM&"));
    }

    @Test
    void shouldFallBackToRealmWhenOwnerLookupFails() {
        when(identityPort.lookupAttribute(any(), any())).thenThrow(NotFoundException.user("alice"));

        assertEquals("EXAMPLE.COM", builder.resolveIssuer(ALICE_REF));
    }

    @Test
    void shouldFallBackToRealmWhenPrincipalMissing() {
        when(identityPort.lookupAttribute(any(), any())).thenReturn(Optional.empty());

        assertEquals("EXAMPLE.COM", builder.resolveIssuer(ALICE_REF));
    }

    @Test
    void shouldPercentEncodeLabel() {
        assertEquals("my%20token", ProvisioningUriBuilder.quote("my token"));
        assertEquals("team/phone~1", ProvisioningUriBuilder.quote("team/phone~1"));
        assertEquals("a%3Ab%2A", ProvisioningUriBuilder.quote("a:b*"));
    }

    private static OtpToken token(String id, TokenParameters parameters) {
        return OtpToken.builder()
                .id(id)
                .key(new byte[20])
                .parameters(parameters)
                .build();
    }
}

package me.golemcore.otp.domain.service;

import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.HotpParameters;
import me.golemcore.otp.domain.model.OtpToken;
import me.golemcore.otp.domain.model.TokenAlgorithm;
import me.golemcore.otp.domain.model.TokenCreateRequest;
import me.golemcore.otp.domain.model.TokenInfoField;
import me.golemcore.otp.domain.model.TokenOutputOptions;
import me.golemcore.otp.domain.model.TokenParameters;
import me.golemcore.otp.domain.model.TokenType;
import me.golemcore.otp.domain.model.TokenUpdateRequest;
import me.golemcore.otp.domain.model.TokenView;
import me.golemcore.otp.domain.model.TotpParameters;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TokenSchemaResolverTest {

    private static final String OWNER_REF = "uid=alice,cn=users,cn=accounts,dc=example,dc=com";

    private final TokenSchemaResolver resolver = new TokenSchemaResolver();

    @Test
    void shouldDropHotpCounterFromTotpToken() {
        TokenCreateRequest request = TokenCreateRequest.builder()
                .timeStep(60)
                .counter(7L)
                .build();

        TokenParameters parameters = resolver.resolveParameters(TokenType.TOTP, request);
        DirectoryEntry entry = resolver.toEntry(token("abc", parameters));

        assertEquals(new TotpParameters(0, 60), parameters);
        assertFalse(entry.contains("hotpcounter"));
        assertEquals("60", entry.getSingle("totptimestep"));
        assertEquals("0", entry.getSingle("totpclockoffset"));
    }

    @Test
    void shouldDropTotpFieldsFromHotpToken() {
        TokenCreateRequest request = TokenCreateRequest.builder()
                .clockOffset(15)
                .timeStep(60)
                .counter(7L)
                .build();

        TokenParameters parameters = resolver.resolveParameters(TokenType.HOTP, request);
        DirectoryEntry entry = resolver.toEntry(token("abc", parameters));

        assertEquals(new HotpParameters(7), parameters);
        assertEquals("7", entry.getSingle("hotpcounter"));
        assertFalse(entry.contains("totptimestep"));
        assertFalse(entry.contains("totpclockoffset"));
    }

    @Test
    void shouldWriteSchemaMarkersAndBase64Key() {
        DirectoryEntry entry = resolver.toEntry(token("abc", TotpParameters.of(null, null)));

        assertEquals(List.of("otptoken", "otptokentotp"), entry.get("objectclass"));
        assertEquals("AAAAAAAAAAAAAAAAAAAAAAAAAAA=", entry.getSingle("otpkey"));
        assertEquals("sha1", entry.getSingle("otpalgorithm"));
        assertEquals("6", entry.getSingle("otpdigits"));
        assertEquals("FALSE", entry.getSingle("disabled"));
        assertEquals(OWNER_REF, entry.getSingle("owner"));
        assertEquals("Phone", entry.getSingle("description"));
        assertFalse(entry.contains("notbefore"));
    }

    @Test
    void shouldDeriveViewTypeFromMarkers() {
        DirectoryEntry entry = resolver.toEntry(token("abc", HotpParameters.of(3L)));

        TokenView view = resolver.toView(entry, TokenOutputOptions.DEFAULT);

        assertEquals("abc", view.getId());
        assertEquals("HOTP", view.getType());
        assertEquals("Phone", view.getDescription());
        assertEquals(OWNER_REF, view.getOwner());
        assertEquals(Boolean.FALSE, view.getDisabled());
        assertNull(view.getCounter());
        assertNull(view.getObjectClasses());
    }

    @Test
    void shouldLeaveTypeUnsetWithoutMarker() {
        DirectoryEntry entry = new DirectoryEntry()
                .put("objectclass", "otptoken")
                .put("tokenid", "legacy");

        assertNull(resolver.toView(entry, TokenOutputOptions.DEFAULT).getType());
    }

    @Test
    void shouldExposeEverythingWithAllOption() {
        DirectoryEntry entry = resolver.toEntry(token("abc", HotpParameters.of(3L)));
        TokenOutputOptions options = TokenOutputOptions.builder().all(true).build();

        TokenView view = resolver.toView(entry, options);

        assertEquals("sha1", view.getAlgorithm());
        assertEquals(6, view.getDigits());
        assertEquals(3L, view.getCounter());
        assertNull(view.getTimeStep());
        assertEquals(List.of("otptoken", "otptokenhotp"), view.getObjectClasses());
    }

    @Test
    void shouldReturnOnlyIdentifiersWithPkeyOnly() {
        DirectoryEntry entry = resolver.toEntry(token("abc", TotpParameters.of(null, null)));
        TokenOutputOptions options = TokenOutputOptions.builder().pkeyOnly(true).all(true).build();

        TokenView view = resolver.toView(entry, options);

        assertEquals("abc", view.getId());
        assertEquals("TOTP", view.getType());
        assertNull(view.getDescription());
        assertNull(view.getOwner());
        assertNull(view.getAlgorithm());
    }

    @Test
    void shouldBuildPartialChanges() {
        Instant end = Instant.parse("2027-01-01T00:00:00Z");
        TokenUpdateRequest request = TokenUpdateRequest.builder()
                .description("New")
                .disabled(true)
                .notAfter(end)
                .build();

        DirectoryEntry changes = resolver.toChanges(request, null, List.of());

        assertEquals("New", changes.getSingle("description"));
        assertEquals("TRUE", changes.getSingle("disabled"));
        assertEquals("2027-01-01T00:00:00Z", changes.getSingle("notafter"));
        assertTrue(changes.contains("managedby"));
        assertTrue(changes.get("managedby").isEmpty());
        assertFalse(changes.contains("owner"));
        assertFalse(changes.contains("vendor"));
    }

    private static OtpToken token(String id, TokenParameters parameters) {
        Map<TokenInfoField, String> info = new EnumMap<>(TokenInfoField.class);
        info.put(TokenInfoField.DESCRIPTION, "Phone");
        return OtpToken.builder()
                .id(id)
                .key(new byte[20])
                .algorithm(TokenAlgorithm.SHA1)
                .parameters(parameters)
                .owner(OWNER_REF)
                .info(info)
                .build();
    }
}

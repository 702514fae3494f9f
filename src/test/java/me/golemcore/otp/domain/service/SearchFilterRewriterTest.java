package me.golemcore.otp.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchFilterRewriterTest {

    private static final String FILTER = "(&(objectclass=otptoken)(|(tokenid=*a*)(description=*a*)))";

    @Test
    void shouldNarrowGenericPredicateToHotp() {
        String rewritten = SearchFilterRewriter.rewrite(FILTER, "hotp");

        assertTrue(rewritten.contains("(objectclass=otptokenhotp)"));
        assertFalse(rewritten.contains("(objectclass=otptoken)"));
    }

    @Test
    void shouldNarrowGenericPredicateToTotpCaseInsensitively() {
        assertEquals("(objectclass=otptokentotp)",
                SearchFilterRewriter.rewrite("(objectclass=otptoken)", "TOTP"));
    }

    @Test
    void shouldLeaveFilterUnchangedWithoutType() {
        assertEquals(FILTER, SearchFilterRewriter.rewrite(FILTER, null));
    }

    @Test
    void shouldLeaveFilterUnchangedForUnknownType() {
        assertEquals(FILTER, SearchFilterRewriter.rewrite(FILTER, "sms"));
    }
}

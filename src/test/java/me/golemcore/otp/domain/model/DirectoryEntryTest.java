package me.golemcore.otp.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryEntryTest {

    @Test
    void shouldNormalizeAttributeNames() {
        DirectoryEntry entry = new DirectoryEntry().put("TokenID", "abc");

        assertTrue(entry.contains("tokenid"));
        assertEquals("abc", entry.getSingle("TOKENID"));
        assertEquals(List.of(), entry.get("missing"));
        assertNull(entry.getSingle("missing"));
    }

    @Test
    void shouldMaskKeyInToString() {
        DirectoryEntry entry = new DirectoryEntry()
                .put("tokenid", "abc")
                .put("otpkey", "c2VjcmV0");

        assertFalse(entry.toString().contains("c2VjcmV0"));
        assertTrue(entry.toString().contains("abc"));
    }

    @Test
    void shouldSerializeAsPlainAttributeMap() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        DirectoryEntry entry = new DirectoryEntry()
                .put("objectclass", List.of("otptoken", "otptokentotp"))
                .put("tokenid", "abc");

        String json = mapper.writeValueAsString(entry);
        DirectoryEntry parsed = mapper.readValue(json, DirectoryEntry.class);

        assertEquals("{\"objectclass\":[\"otptoken\",\"otptokentotp\"],\"tokenid\":[\"abc\"]}", json);
        assertEquals(entry, parsed);
    }

    @Test
    void copyShouldBeIndependent() {
        DirectoryEntry entry = new DirectoryEntry().put("tokenid", "abc");
        DirectoryEntry copy = entry.copy();

        copy.put("description", "x");

        assertFalse(entry.contains("description"));
    }
}

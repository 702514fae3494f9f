package me.golemcore.otp.domain.service;

import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.TokenView;
import me.golemcore.otp.domain.model.UserIdentity;
import me.golemcore.otp.port.outbound.IdentityPort;
import me.golemcore.otp.port.outbound.TokenDirectoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TokenOwnerResolverTest {

    private static final String ALICE = "alice";
    private static final String BOB = "bob";
    private static final String ALICE_REF = "uid=alice,cn=users,cn=accounts,dc=example,dc=com";
    private static final String BOB_REF = "uid=bob,cn=users,cn=accounts,dc=example,dc=com";
    private static final String CAROL_REF = "uid=carol,cn=users,cn=accounts,dc=example,dc=com";

    private IdentityPort identityPort;
    private TokenDirectoryPort directoryPort;
    private TokenOwnerResolver resolver;

    @BeforeEach
    void setUp() {
        identityPort = mock(IdentityPort.class);
        directoryPort = mock(TokenDirectoryPort.class);
        resolver = new TokenOwnerResolver(identityPort, directoryPort);

        when(identityPort.findUser(anyString())).thenReturn(Optional.empty());
        when(identityPort.findUser(ALICE)).thenReturn(Optional.of(new UserIdentity(ALICE, ALICE_REF)));
        when(identityPort.resolveIdentity(ALICE)).thenReturn(ALICE_REF);
        when(identityPort.resolveIdentity(BOB)).thenReturn(BOB_REF);
        when(identityPort.resolveIdentity("ghost")).thenThrow(new NotFoundException("ghost"));
        when(identityPort.toIdentifier(ALICE_REF)).thenReturn(ALICE);
        when(identityPort.toIdentifier(BOB_REF)).thenReturn(BOB);
    }

    @Test
    void shouldDefaultOwnerAndManagerToCaller() {
        TokenOwnerResolver.Assignment assignment = resolver.applyCreateDefaults(null, null, ALICE);

        assertEquals(ALICE, assignment.owner());
        assertEquals(List.of(ALICE_REF), assignment.managedBy());
    }

    @Test
    void shouldNotManageTokenOwnedBySomeoneElse() {
        TokenOwnerResolver.Assignment assignment = resolver.applyCreateDefaults(BOB, null, ALICE);

        assertEquals(BOB, assignment.owner());
        assertNull(assignment.managedBy());
    }

    @Test
    void shouldKeepExplicitManagers() {
        TokenOwnerResolver.Assignment assignment = resolver.applyCreateDefaults(null, List.of(BOB_REF), ALICE);

        assertEquals(ALICE, assignment.owner());
        assertEquals(List.of(BOB_REF), assignment.managedBy());
    }

    @Test
    void shouldSkipDefaultsForUnknownCaller() {
        TokenOwnerResolver.Assignment assignment = resolver.applyCreateDefaults(null, null, "admin");

        assertNull(assignment.owner());
        assertNull(assignment.managedBy());
    }

    @Test
    void shouldSkipDefaultsWithoutCaller() {
        TokenOwnerResolver.Assignment assignment = resolver.applyCreateDefaults(null, null, null);

        assertNull(assignment.owner());
        assertNull(assignment.managedBy());
    }

    @Test
    void shouldNormalizeOwnerToReference() {
        assertEquals(ALICE_REF, resolver.normalizeOwner(ALICE));
        assertNull(resolver.normalizeOwner(null));
        assertNull(resolver.normalizeOwner(" "));
    }

    @Test
    void shouldReportUnknownOwner() {
        NotFoundException ex = assertThrows(NotFoundException.class, () -> resolver.normalizeOwner("ghost"));
        assertEquals("ghost: user not found", ex.getMessage());
    }

    @Test
    void shouldMoveManagementOfSelfManagedToken() {
        when(directoryPort.read("abc")).thenReturn(new DirectoryEntry()
                .put("owner", ALICE_REF)
                .put("managedby", List.of(ALICE_REF)));

        assertEquals(List.of(BOB_REF), resolver.reassignManagers("abc", BOB_REF));
    }

    @Test
    void shouldKeepDistinctManagerOnOwnerChange() {
        when(directoryPort.read("abc")).thenReturn(new DirectoryEntry()
                .put("owner", ALICE_REF)
                .put("managedby", List.of(CAROL_REF)));

        assertNull(resolver.reassignManagers("abc", BOB_REF));
    }

    @Test
    void shouldKeepManagersWhenOwnerUnchanged() {
        when(directoryPort.read("abc")).thenReturn(new DirectoryEntry()
                .put("owner", ALICE_REF)
                .put("managedby", List.of(ALICE_REF)));

        assertNull(resolver.reassignManagers("abc", ALICE_REF));
    }

    @Test
    void shouldNotTreatUnmanagedTokenAsSelfManaged() {
        when(directoryPort.read("abc")).thenReturn(new DirectoryEntry().put("owner", ALICE_REF));

        assertNull(resolver.reassignManagers("abc", BOB_REF));
    }

    @Test
    void shouldTreatUnownedTokenAsSelfManaged() {
        when(directoryPort.read("abc")).thenReturn(new DirectoryEntry().put("tokenid", "abc"));

        assertEquals(List.of(BOB_REF), resolver.reassignManagers("abc", BOB_REF));
    }

    @Test
    void shouldDenormalizeReferencesUnlessRaw() {
        TokenView view = TokenView.builder().owner(ALICE_REF).managedBy(List.of(ALICE_REF, BOB_REF)).build();
        TokenView raw = TokenView.builder().owner(ALICE_REF).managedBy(List.of(ALICE_REF)).build();

        resolver.denormalize(view, false);
        resolver.denormalize(raw, true);

        assertEquals(ALICE, view.getOwner());
        assertEquals(List.of(ALICE, BOB), view.getManagedBy());
        assertEquals(ALICE_REF, raw.getOwner());
    }
}

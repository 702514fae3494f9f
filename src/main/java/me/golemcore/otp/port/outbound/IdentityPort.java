package me.golemcore.otp.port.outbound;

import me.golemcore.otp.domain.model.UserIdentity;

import java.util.Optional;

/**
 * Port for user lookups against the directory.
 */
public interface IdentityPort {

    /**
     * Find a user by identifier.
     */
    Optional<UserIdentity> findUser(String uid);

    /**
     * Resolve a user identifier to its canonical reference.
     *
     * @throws me.golemcore.otp.domain.exception.NotFoundException
     *             when no such user exists
     */
    String resolveIdentity(String uid);

    /**
     * Convert a canonical user reference back to the user identifier.
     */
    String toIdentifier(String reference);

    /**
     * Read a single attribute of the entry behind a reference.
     */
    Optional<String> lookupAttribute(String reference, String attribute);
}

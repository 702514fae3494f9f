package me.golemcore.otp.domain.model;

/**
 * A directory user as seen by the token service.
 *
 * @param uid
 *            user identifier shown to callers
 * @param reference
 *            canonical directory reference stored on tokens
 */
public record UserIdentity(String uid, String reference) {
}

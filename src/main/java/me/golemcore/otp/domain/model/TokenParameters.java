package me.golemcore.otp.domain.model;

/**
 * Type-specific part of a token. Exactly one implementation exists per
 * {@link TokenType}, so a token can never carry the parameters of another
 * type.
 */
public interface TokenParameters {

    TokenType type();
}

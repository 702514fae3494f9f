package me.golemcore.otp.domain.model;

import me.golemcore.otp.domain.exception.TokenValidationException;

/**
 * Parameters of a counter-based token.
 *
 * @param counter
 *            initial moving factor
 */
public record HotpParameters(long counter) implements TokenParameters {

    public static final long DEFAULT_COUNTER = 0;

    public HotpParameters {
        if (counter < 0) {
            throw new TokenValidationException("counter", "must be at least 0");
        }
    }

    public static HotpParameters of(Long counter) {
        return new HotpParameters(counter != null ? counter : DEFAULT_COUNTER);
    }

    @Override
    public TokenType type() {
        return TokenType.HOTP;
    }
}

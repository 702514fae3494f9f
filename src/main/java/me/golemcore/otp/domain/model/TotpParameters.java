package me.golemcore.otp.domain.model;

import me.golemcore.otp.domain.exception.TokenValidationException;

/**
 * Parameters of a time-based token.
 *
 * @param clockOffset
 *            difference between the token clock and the server clock, in
 *            seconds
 * @param timeStep
 *            length of one code validity window, in seconds
 */
public record TotpParameters(int clockOffset, int timeStep) implements TokenParameters {

    public static final int DEFAULT_CLOCK_OFFSET = 0;
    public static final int DEFAULT_TIME_STEP = 30;
    public static final int MIN_TIME_STEP = 5;

    public TotpParameters {
        if (timeStep < MIN_TIME_STEP) {
            throw new TokenValidationException("timeStep", "must be at least " + MIN_TIME_STEP);
        }
    }

    public static TotpParameters of(Integer clockOffset, Integer timeStep) {
        return new TotpParameters(
                clockOffset != null ? clockOffset : DEFAULT_CLOCK_OFFSET,
                timeStep != null ? timeStep : DEFAULT_TIME_STEP);
    }

    @Override
    public TokenType type() {
        return TokenType.TOTP;
    }
}

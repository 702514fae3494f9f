package me.golemcore.otp.domain.exception;

/**
 * The synchronization endpoint could not be reached.
 */
public class TokenSyncException extends OtpTokenException {

    public TokenSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}

package me.golemcore.otp.domain.exception;

/**
 * Base class of all failures raised by the token service.
 */
public class OtpTokenException extends RuntimeException {

    public OtpTokenException(String message) {
        super(message);
    }

    public OtpTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}

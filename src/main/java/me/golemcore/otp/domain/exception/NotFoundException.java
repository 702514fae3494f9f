package me.golemcore.otp.domain.exception;

/**
 * A referenced token or user does not exist.
 */
public class NotFoundException extends OtpTokenException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException token(String id) {
        return new NotFoundException(id + ": OTP token not found");
    }

    public static NotFoundException user(String uid) {
        return new NotFoundException(uid + ": user not found");
    }
}

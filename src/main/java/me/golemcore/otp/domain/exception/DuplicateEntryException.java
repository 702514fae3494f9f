package me.golemcore.otp.domain.exception;

public class DuplicateEntryException extends OtpTokenException {

    public DuplicateEntryException(String id) {
        super("OTP token with name \"" + id + "\" already exists");
    }
}

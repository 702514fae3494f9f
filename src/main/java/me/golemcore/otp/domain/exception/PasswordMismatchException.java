package me.golemcore.otp.domain.exception;

/**
 * A value and its confirmation differ.
 */
public class PasswordMismatchException extends OtpTokenException {

    private final String field;

    public PasswordMismatchException(String field) {
        super(field + ": Passwords do not match");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

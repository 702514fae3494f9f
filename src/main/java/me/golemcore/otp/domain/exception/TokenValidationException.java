package me.golemcore.otp.domain.exception;

/**
 * A field value breaks a constraint. {@link #getField()} names the field the
 * caller has to change.
 */
public class TokenValidationException extends OtpTokenException {

    private final String field;
    private final String error;

    public TokenValidationException(String field, String error) {
        super("invalid '" + field + "': " + error);
        this.field = field;
        this.error = error;
    }

    public String getField() {
        return field;
    }

    public String getError() {
        return error;
    }
}

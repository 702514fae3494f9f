package me.golemcore.otp.domain.exception;

/**
 * A value could not be converted to its internal representation.
 */
public class ConversionException extends OtpTokenException {

    private final String field;

    public ConversionException(String field, String error, Throwable cause) {
        super("invalid '" + field + "': " + error, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

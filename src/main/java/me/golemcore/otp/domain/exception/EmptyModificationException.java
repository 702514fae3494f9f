package me.golemcore.otp.domain.exception;

/**
 * An update request carries no changes.
 */
public class EmptyModificationException extends OtpTokenException {

    public EmptyModificationException() {
        super("no modifications to be performed");
    }
}

package me.golemcore.otp.domain.model;

/**
 * Free-text informational fields of a token. They carry no semantics and are
 * never validated.
 */
public enum TokenInfoField {

    DESCRIPTION(TokenAttributes.DESCRIPTION),
    VENDOR(TokenAttributes.VENDOR),
    MODEL(TokenAttributes.MODEL),
    SERIAL(TokenAttributes.SERIAL);

    private final String attribute;

    TokenInfoField(String attribute) {
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}

package me.golemcore.otp.domain.model;

import java.nio.charset.StandardCharsets;

/**
 * Secret key as supplied by a caller: raw bytes or base32 text, optionally
 * accompanied by a confirmation value of the same kind.
 *
 * <p>
 * Values are kept exactly as supplied; decoding happens in
 * {@link me.golemcore.otp.domain.service.TokenKeyCodec}.
 */
public final class TokenKeyInput {

    private final byte[] value;
    private final byte[] confirmation;
    private final boolean encoded;

    private TokenKeyInput(byte[] value, byte[] confirmation, boolean encoded) {
        this.value = value;
        this.confirmation = confirmation;
        this.encoded = encoded;
    }

    public static TokenKeyInput ofBytes(byte[] value) {
        return new TokenKeyInput(value.clone(), null, false);
    }

    public static TokenKeyInput ofBytes(byte[] value, byte[] confirmation) {
        return new TokenKeyInput(value.clone(), confirmation.clone(), false);
    }

    public static TokenKeyInput ofBase32(String value) {
        return new TokenKeyInput(value.getBytes(StandardCharsets.UTF_8), null, true);
    }

    public static TokenKeyInput ofBase32(String value, String confirmation) {
        return new TokenKeyInput(value.getBytes(StandardCharsets.UTF_8),
                confirmation.getBytes(StandardCharsets.UTF_8), true);
    }

    public byte[] getValue() {
        return value.clone();
    }

    public byte[] getConfirmation() {
        return confirmation == null ? null : confirmation.clone();
    }

    public boolean hasConfirmation() {
        return confirmation != null;
    }

    /**
     * {@code true} when the value is base32 text rather than raw key bytes.
     */
    public boolean isEncoded() {
        return encoded;
    }

    @Override
    public String toString() {
        return "TokenKeyInput[encoded=" + encoded + ", confirmed=" + hasConfirmation() + "]";
    }
}

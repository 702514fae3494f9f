package me.golemcore.otp.domain.model;

import java.util.Arrays;

/**
 * Result reported by the server after a token synchronization attempt.
 */
public enum SyncStatus {

    OK("ok", "Token synchronized."),
    ERROR("error", "Error contacting server!"),
    INVALID_CREDENTIALS("invalid-credentials", "Invalid Credentials!"),
    UNKNOWN("unknown", "Unknown Error!");

    private final String value;
    private final String message;

    SyncStatus(String value, String message) {
        this.value = value;
        this.message = message;
    }

    public String getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    public static SyncStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value.trim()))
                .findFirst()
                .orElse(UNKNOWN);
    }
}

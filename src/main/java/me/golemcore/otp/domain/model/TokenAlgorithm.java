package me.golemcore.otp.domain.model;

import me.golemcore.otp.domain.exception.TokenValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * HMAC hash algorithm a token computes its codes with.
 */
public enum TokenAlgorithm {

    SHA1, SHA256, SHA384, SHA512;

    public static final TokenAlgorithm DEFAULT = SHA1;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TokenAlgorithm fromValue(String value) {
        if (value == null) {
            return DEFAULT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new TokenValidationException("algorithm",
                        "must be one of: sha1, sha256, sha384, sha512"));
    }
}

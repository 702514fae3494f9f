package me.golemcore.otp.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.otp.domain.exception.TokenValidationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of OTP token types. Each type owns a schema-class marker and the
 * group of attributes that only tokens of that type may carry.
 */
public enum TokenType {

    TOTP(List.of(TokenAttributes.TOTP_CLOCK_OFFSET, TokenAttributes.TOTP_TIME_STEP)),

    HOTP(List.of(TokenAttributes.HOTP_COUNTER));

    private final List<String> attributes;

    TokenType(List<String> attributes) {
        this.attributes = attributes;
    }

    /**
     * Lower-case tag used in filters, URIs and requests ({@code totp},
     * {@code hotp}).
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getObjectClass() {
        return TokenAttributes.TOKEN_CLASS + getValue();
    }

    public List<String> getAttributes() {
        return attributes;
    }

    public static Optional<TokenType> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.getValue().equals(normalized))
                .findFirst();
    }

    public static TokenType fromValue(String value) {
        return find(value).orElseThrow(() -> new TokenValidationException("type",
                "must be one of: " + Arrays.stream(values())
                        .map(TokenType::getValue)
                        .collect(Collectors.joining(", "))));
    }

    /**
     * Resolves the type from the schema-class markers of a stored entry. The
     * first marker naming a known type wins.
     */
    public static Optional<TokenType> fromObjectClasses(Collection<String> objectClasses) {
        if (objectClasses == null) {
            return Optional.empty();
        }
        List<String> lowered = objectClasses.stream()
                .map(oc -> oc.toLowerCase(Locale.ROOT))
                .toList();
        for (String objectClass : lowered) {
            for (TokenType type : values()) {
                if (type.getObjectClass().equals(objectClass)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }
}

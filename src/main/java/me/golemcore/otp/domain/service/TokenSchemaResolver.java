package me.golemcore.otp.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.HotpParameters;
import me.golemcore.otp.domain.model.OtpToken;
import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.domain.model.TokenCreateRequest;
import me.golemcore.otp.domain.model.TokenInfoField;
import me.golemcore.otp.domain.model.TokenOutputOptions;
import me.golemcore.otp.domain.model.TokenParameters;
import me.golemcore.otp.domain.model.TokenType;
import me.golemcore.otp.domain.model.TokenUpdateRequest;
import me.golemcore.otp.domain.model.TokenView;
import me.golemcore.otp.domain.model.TotpParameters;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps tokens between their typed form and the flat directory entry.
 *
 * <p>
 * On the way in, only the attribute group of the token's own type is written;
 * type-specific values supplied for another type are dropped. On the way out,
 * the token type is derived from the schema-class markers of the stored entry.
 */
@Component
@Slf4j
public class TokenSchemaResolver {

    /**
     * Build the type-specific parameters of a new token. Values the caller
     * supplied for another type are ignored.
     */
    public TokenParameters resolveParameters(TokenType type, TokenCreateRequest request) {
        Map<String, Object> supplied = new LinkedHashMap<>();
        supplied.put(TokenAttributes.TOTP_CLOCK_OFFSET, request.getClockOffset());
        supplied.put(TokenAttributes.TOTP_TIME_STEP, request.getTimeStep());
        supplied.put(TokenAttributes.HOTP_COUNTER, request.getCounter());

        for (TokenType other : TokenType.values()) {
            if (other == type) {
                continue;
            }
            for (String attribute : other.getAttributes()) {
                if (supplied.get(attribute) != null) {
                    log.debug("[OtpToken] Dropping {} attribute '{}' from {} token", other.getValue(), attribute,
                            type.getValue());
                }
            }
        }

        return switch (type) {
        case TOTP -> TotpParameters.of(request.getClockOffset(), request.getTimeStep());
        case HOTP -> HotpParameters.of(request.getCounter());
        };
    }

    public DirectoryEntry toEntry(OtpToken token) {
        TokenType type = token.getType();
        DirectoryEntry entry = new DirectoryEntry();
        entry.put(TokenAttributes.OBJECT_CLASS, List.of(TokenAttributes.TOKEN_CLASS, type.getObjectClass()));
        entry.put(TokenAttributes.TOKEN_ID, token.getId());
        entry.put(TokenAttributes.KEY, Base64.getEncoder().encodeToString(token.getKey()));
        entry.put(TokenAttributes.ALGORITHM, token.getAlgorithm().getValue());
        entry.put(TokenAttributes.DIGITS, String.valueOf(token.getDigits()));

        if (token.getParameters() instanceof TotpParameters totp) {
            entry.put(TokenAttributes.TOTP_CLOCK_OFFSET, String.valueOf(totp.clockOffset()));
            entry.put(TokenAttributes.TOTP_TIME_STEP, String.valueOf(totp.timeStep()));
        } else if (token.getParameters() instanceof HotpParameters hotp) {
            entry.put(TokenAttributes.HOTP_COUNTER, String.valueOf(hotp.counter()));
        }

        putIfPresent(entry, TokenAttributes.OWNER, token.getOwner());
        if (token.getManagedBy() != null && !token.getManagedBy().isEmpty()) {
            entry.put(TokenAttributes.MANAGED_BY, token.getManagedBy());
        }
        entry.put(TokenAttributes.DISABLED, formatBoolean(token.isDisabled()));
        putIfPresent(entry, TokenAttributes.NOT_BEFORE, formatInstant(token.getNotBefore()));
        putIfPresent(entry, TokenAttributes.NOT_AFTER, formatInstant(token.getNotAfter()));
        token.getInfo().forEach((field, value) -> putIfPresent(entry, field.getAttribute(), value));
        return entry;
    }

    /**
     * Build the attribute changes of a partial update. Owner and managers must
     * already be canonical references.
     */
    public DirectoryEntry toChanges(TokenUpdateRequest request, String owner, List<String> managedBy) {
        DirectoryEntry changes = new DirectoryEntry();
        putIfPresent(changes, TokenAttributes.OWNER, owner);
        if (managedBy != null) {
            changes.put(TokenAttributes.MANAGED_BY, managedBy);
        }
        if (request.getDisabled() != null) {
            changes.put(TokenAttributes.DISABLED, formatBoolean(request.getDisabled()));
        }
        putIfPresent(changes, TokenAttributes.NOT_BEFORE, formatInstant(request.getNotBefore()));
        putIfPresent(changes, TokenAttributes.NOT_AFTER, formatInstant(request.getNotAfter()));
        putIfPresent(changes, TokenInfoField.DESCRIPTION.getAttribute(), request.getDescription());
        putIfPresent(changes, TokenInfoField.VENDOR.getAttribute(), request.getVendor());
        putIfPresent(changes, TokenInfoField.MODEL.getAttribute(), request.getModel());
        putIfPresent(changes, TokenInfoField.SERIAL.getAttribute(), request.getSerial());
        return changes;
    }

    /**
     * Turn a stored entry into a caller view. Owner and managers are left as
     * stored references.
     */
    public TokenView toView(DirectoryEntry entry, TokenOutputOptions options) {
        List<String> objectClasses = entry.get(TokenAttributes.OBJECT_CLASS);
        String type = TokenType.fromObjectClasses(objectClasses)
                .map(t -> t.name().toUpperCase(Locale.ROOT))
                .orElse(null);

        TokenView.TokenViewBuilder view = TokenView.builder()
                .id(entry.getSingle(TokenAttributes.TOKEN_ID))
                .type(type);
        if (options.isPkeyOnly()) {
            return view.build();
        }

        view.description(entry.getSingle(TokenAttributes.DESCRIPTION))
                .owner(entry.getSingle(TokenAttributes.OWNER))
                .managedBy(entry.contains(TokenAttributes.MANAGED_BY)
                        ? new ArrayList<>(entry.get(TokenAttributes.MANAGED_BY))
                        : null)
                .disabled(parseBoolean(entry.getSingle(TokenAttributes.DISABLED)))
                .notBefore(parseInstant(entry.getSingle(TokenAttributes.NOT_BEFORE)))
                .notAfter(parseInstant(entry.getSingle(TokenAttributes.NOT_AFTER)))
                .vendor(entry.getSingle(TokenAttributes.VENDOR))
                .model(entry.getSingle(TokenAttributes.MODEL))
                .serial(entry.getSingle(TokenAttributes.SERIAL));

        if (options.isAll()) {
            String algorithm = entry.getSingle(TokenAttributes.ALGORITHM);
            view.algorithm(algorithm)
                    .digits(parseInteger(entry.getSingle(TokenAttributes.DIGITS)))
                    .clockOffset(parseInteger(entry.getSingle(TokenAttributes.TOTP_CLOCK_OFFSET)))
                    .timeStep(parseInteger(entry.getSingle(TokenAttributes.TOTP_TIME_STEP)))
                    .counter(parseLong(entry.getSingle(TokenAttributes.HOTP_COUNTER)))
                    .objectClasses(objectClasses.isEmpty() ? null : new ArrayList<>(objectClasses));
        }
        return view.build();
    }

    static Instant parseInstant(String value) {
        return value != null ? Instant.parse(value) : null;
    }

    private static String formatInstant(Instant value) {
        return value != null ? value.toString() : null;
    }

    static String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    private static Boolean parseBoolean(String value) {
        return value != null ? Boolean.valueOf(value) : null;
    }

    private static Integer parseInteger(String value) {
        return value != null ? Integer.valueOf(value) : null;
    }

    private static Long parseLong(String value) {
        return value != null ? Long.valueOf(value) : null;
    }

    private static void putIfPresent(DirectoryEntry entry, String name, String value) {
        if (value != null) {
            entry.put(name, value);
        }
    }
}

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.model.HotpParameters;
import me.golemcore.otp.domain.model.OtpToken;
import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.domain.model.TotpParameters;
import me.golemcore.otp.infrastructure.config.OtpProperties;
import me.golemcore.otp.port.outbound.IdentityPort;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the {@code otpauth://} provisioning URI of a newly created token.
 *
 * <p>
 * Format:
 *
 * <pre>
 * otpauth://{type}/{issuer}:{label}?issuer=..&amp;secret=..&amp;digits=..&amp;algorithm=..&amp;period=..
 * </pre>
 *
 * where {@code period} is replaced by {@code counter} for HOTP tokens. The
 * issuer is the owner's principal name, or the realm when it cannot be found.
 * The URI is the only place the key is ever shown in clear text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProvisioningUriBuilder {

    private static final String SCHEME = "otpauth://";

    private final IdentityPort identityPort;
    private final TokenKeyCodec keyCodec;
    private final OtpProperties properties;

    public String build(OtpToken token) {
        return build(token, resolveIssuer(token.getOwner()));
    }

    public String build(OtpToken token, String issuer) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("issuer", issuer);
        parameters.put("secret", keyCodec.encode(token.getKey()));
        parameters.put("digits", String.valueOf(token.getDigits()));
        parameters.put("algorithm", token.getAlgorithm().name().toUpperCase(Locale.ROOT));
        if (token.getParameters() instanceof TotpParameters totp) {
            parameters.put("period", String.valueOf(totp.timeStep()));
        } else if (token.getParameters() instanceof HotpParameters hotp) {
            parameters.put("counter", String.valueOf(hotp.counter()));
        }

        String query = parameters.entrySet().stream()
                .map(e -> formEncode(e.getKey()) + "=" + formEncode(e.getValue()))
                .collect(Collectors.joining("&"));

        return SCHEME + token.getType().getValue() + "/" + issuer + ":" + quote(token.getId()) + "?" + query;
    }

    /**
     * Principal name of the owner, falling back to the realm when the owner is
     * unset, unknown or has no principal name.
     */
    public String resolveIssuer(String ownerReference) {
        if (ownerReference == null) {
            return properties.getRealm();
        }
        try {
            Optional<String> principal = identityPort.lookupAttribute(ownerReference,
                    TokenAttributes.PRINCIPAL_NAME);
            if (principal.isPresent()) {
                return principal.get();
            }
        } catch (NotFoundException e) {
            log.debug("[OtpToken] Owner {} not found, using realm as issuer", ownerReference);
        }
        return properties.getRealm();
    }

    private static String formEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Percent-encode a path segment: spaces become {@code %20}, slashes and
     * tildes stay literal.
     */
    static String quote(String value) {
        return formEncode(value)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%2F", "/")
                .replace("%7E", "~");
    }
}

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

import me.golemcore.otp.domain.exception.ConversionException;
import me.golemcore.otp.domain.exception.PasswordMismatchException;
import me.golemcore.otp.domain.model.TokenKeyInput;
import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Encodes, decodes and generates token key material.
 *
 * <p>
 * Text keys use the RFC 4648 base32 alphabet, case-insensitive. Padding is
 * optional on input and never emitted on output.
 */
@Component
public class TokenKeyCodec {

    /** Generated key length in bytes; a multiple of 5 keeps base32 unpadded. */
    public static final int KEY_LENGTH = 20;

    static final String FIELD = "key";

    private static final Pattern BASE32_PATTERN = Pattern.compile("^[A-Z2-7]+=*$");
    private static final byte PAD = '=';
    private static final Set<Integer> VALID_PADDING = Set.of(1, 3, 4, 6);

    private final SecureRandom secureRandom;
    private final Base32 strictBase32 = new Base32(0, null, false, PAD, CodecPolicy.STRICT);

    public TokenKeyCodec() {
        this(new SecureRandom());
    }

    TokenKeyCodec(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Turn caller input into key bytes. A missing input yields a freshly
     * generated key.
     *
     * @throws PasswordMismatchException
     *             when the value and its confirmation differ
     * @throws ConversionException
     *             when base32 text cannot be decoded
     */
    public byte[] resolve(TokenKeyInput input) {
        if (input == null) {
            return generate();
        }
        byte[] value = input.getValue();
        if (input.hasConfirmation() && !Arrays.equals(value, input.getConfirmation())) {
            throw new PasswordMismatchException(FIELD);
        }
        if (input.isEncoded()) {
            return decode(new String(value, StandardCharsets.UTF_8));
        }
        return value;
    }

    public byte[] generate() {
        byte[] key = new byte[KEY_LENGTH];
        secureRandom.nextBytes(key);
        return key;
    }

    public byte[] decode(String text) {
        String normalized = text.toUpperCase(Locale.ROOT);
        if (!BASE32_PATTERN.matcher(normalized).matches()) {
            throw new ConversionException(FIELD, "Non-base32 digit found", null);
        }
        int padStart = normalized.indexOf(PAD);
        if (padStart >= 0) {
            int padding = normalized.length() - padStart;
            if (normalized.length() % 8 != 0 || !VALID_PADDING.contains(padding)) {
                throw new ConversionException(FIELD, "Incorrect padding (" + padding + " pad characters)", null);
            }
        }
        try {
            return strictBase32.decode(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConversionException(FIELD, e.getMessage(), e);
        }
    }

    public String encode(byte[] key) {
        String encoded = strictBase32.encodeAsString(key);
        int end = encoded.indexOf(PAD);
        return end >= 0 ? encoded.substring(0, end) : encoded;
    }
}

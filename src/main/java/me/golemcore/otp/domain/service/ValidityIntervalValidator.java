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
import me.golemcore.otp.domain.exception.TokenValidationException;
import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.port.outbound.TokenDirectoryPort;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Enforces {@code notBefore <= notAfter} on token validity bounds.
 *
 * <p>
 * A partial update that sets only one bound is checked against the stored value
 * of the other one.
 */
@Component
@RequiredArgsConstructor
public class ValidityIntervalValidator {

    static final String NOT_BEFORE = "notBefore";
    static final String NOT_AFTER = "notAfter";
    static final String BEFORE_START = "is before the validity start";
    static final String AFTER_END = "is after the validity end";

    private final TokenDirectoryPort directoryPort;

    public static boolean isOrdered(Instant notBefore, Instant notAfter) {
        if (notBefore != null && notAfter != null) {
            return !notBefore.isAfter(notAfter);
        }
        return true;
    }

    public void validateCreate(Instant notBefore, Instant notAfter) {
        if (!isOrdered(notBefore, notAfter)) {
            throw new TokenValidationException(NOT_AFTER, BEFORE_START);
        }
    }

    public void validateUpdate(String id, Instant notBefore, Instant notAfter) {
        boolean notAfterSet = true;
        if ((notBefore == null) != (notAfter == null)) {
            DirectoryEntry stored = directoryPort.read(id);
            if (notBefore == null) {
                notBefore = TokenSchemaResolver.parseInstant(stored.getSingle(TokenAttributes.NOT_BEFORE));
            }
            if (notAfter == null) {
                notAfterSet = false;
                notAfter = TokenSchemaResolver.parseInstant(stored.getSingle(TokenAttributes.NOT_AFTER));
            }
        }

        if (!isOrdered(notBefore, notAfter)) {
            if (notAfterSet) {
                throw new TokenValidationException(NOT_AFTER, BEFORE_START);
            }
            throw new TokenValidationException(NOT_BEFORE, AFTER_END);
        }
    }
}

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved OTP token, ready to be written to the directory.
 *
 * <p>
 * The token type is implied by {@link #parameters}: a {@link TotpParameters}
 * instance makes a TOTP token, a {@link HotpParameters} instance a HOTP token.
 * Owner and managers hold canonical directory references, not user
 * identifiers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OtpToken {

    private String id;

    @ToString.Exclude
    private byte[] key;

    @Builder.Default
    private TokenAlgorithm algorithm = TokenAlgorithm.DEFAULT;

    @Builder.Default
    private int digits = 6;

    private TokenParameters parameters;

    private String owner;

    @Builder.Default
    private List<String> managedBy = new ArrayList<>();

    @Builder.Default
    private boolean disabled = false;

    private Instant notBefore;

    private Instant notAfter;

    @Builder.Default
    private Map<TokenInfoField, String> info = new EnumMap<>(TokenInfoField.class);

    public TokenType getType() {
        return parameters != null ? parameters.type() : null;
    }
}

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

import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.domain.model.TokenType;

import java.util.Optional;

/**
 * Narrows a token search filter to one token type.
 *
 * <p>
 * The generic {@code (objectclass=otptoken)} predicate is replaced textually by
 * the type-specific one. Unknown or missing types leave the filter as it is, so
 * the search matches tokens of all types.
 */
public final class SearchFilterRewriter {

    public static final String GENERIC_PREDICATE = predicate(TokenAttributes.TOKEN_CLASS);

    private SearchFilterRewriter() {
    }

    public static String rewrite(String filter, String type) {
        Optional<TokenType> tokenType = TokenType.find(type);
        if (tokenType.isEmpty()) {
            return filter;
        }
        return filter.replace(GENERIC_PREDICATE, predicate(tokenType.get().getObjectClass()));
    }

    private static String predicate(String objectClass) {
        return "(" + TokenAttributes.OBJECT_CLASS + "=" + objectClass + ")";
    }
}

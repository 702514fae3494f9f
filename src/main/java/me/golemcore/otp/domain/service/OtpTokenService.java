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
import me.golemcore.otp.domain.exception.EmptyModificationException;
import me.golemcore.otp.domain.exception.TokenValidationException;
import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.DirectorySearchResult;
import me.golemcore.otp.domain.model.ManagerUpdateResult;
import me.golemcore.otp.domain.model.OtpToken;
import me.golemcore.otp.domain.model.TokenAlgorithm;
import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.domain.model.TokenCreateRequest;
import me.golemcore.otp.domain.model.TokenInfoField;
import me.golemcore.otp.domain.model.TokenOutputOptions;
import me.golemcore.otp.domain.model.TokenParameters;
import me.golemcore.otp.domain.model.TokenSearchRequest;
import me.golemcore.otp.domain.model.TokenSearchResult;
import me.golemcore.otp.domain.model.TokenType;
import me.golemcore.otp.domain.model.TokenUpdateRequest;
import me.golemcore.otp.domain.model.TokenView;
import me.golemcore.otp.domain.model.UserIdentity;
import me.golemcore.otp.infrastructure.config.OtpProperties;
import me.golemcore.otp.port.outbound.IdentityPort;
import me.golemcore.otp.port.outbound.TokenDirectoryPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Domain service for OTP token management: add, show, modify, delete, search
 * and manager membership.
 *
 * <p>
 * Every operation runs in two phases around the directory call. Pre-processing
 * validates and normalizes the request (validity interval, type schema, key,
 * ownership); post-processing turns the stored entry into a {@link TokenView}
 * for the caller. The provisioning URI of a new token is computed before the
 * entry is written and handed to post-processing through a
 * {@link TokenCreation} value, never through shared state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OtpTokenService {

    static final String DEFAULT_TYPE = "totp";
    private static final Set<Integer> ALLOWED_DIGITS = Set.of(6, 8);

    private final TokenDirectoryPort directoryPort;
    private final IdentityPort identityPort;
    private final TokenKeyCodec keyCodec;
    private final TokenSchemaResolver schemaResolver;
    private final ValidityIntervalValidator validityValidator;
    private final TokenOwnerResolver ownerResolver;
    private final ProvisioningUriBuilder uriBuilder;
    private final OtpProperties properties;

    /**
     * Result accumulator of a single add operation.
     */
    record TokenCreation(OtpToken token, String uri) {
    }

    public TokenView add(TokenCreateRequest request, String caller, TokenOutputOptions options) {
        TokenCreation creation = prepare(request, caller);
        DirectoryEntry stored = directoryPort.create(schemaResolver.toEntry(creation.token()));
        log.info("[OtpToken] Added {} token {}", creation.token().getType().getValue(), creation.token().getId());

        TokenView view = present(stored, options);
        view.setUri(creation.uri());
        return view;
    }

    public TokenView show(String id, TokenOutputOptions options) {
        return present(directoryPort.read(id), options);
    }

    public TokenView update(String id, TokenUpdateRequest request, TokenOutputOptions options) {
        if (request.isEmpty()) {
            throw new EmptyModificationException();
        }
        validityValidator.validateUpdate(id, request.getNotBefore(), request.getNotAfter());

        String owner = ownerResolver.normalizeOwner(request.getOwner());
        List<String> managedBy = request.getManagedBy() != null ? resolveManagers(request.getManagedBy()) : null;
        if (owner != null && managedBy == null) {
            managedBy = ownerResolver.reassignManagers(id, owner);
        }

        DirectoryEntry changes = schemaResolver.toChanges(request, owner, managedBy);
        if (changes.isEmpty()) {
            throw new EmptyModificationException();
        }
        DirectoryEntry updated = directoryPort.update(id, changes);
        log.info("[OtpToken] Modified token {}", id);
        return present(updated, options);
    }

    public void delete(String id) {
        directoryPort.delete(id);
        log.info("[OtpToken] Deleted token {}", id);
    }

    public TokenSearchResult find(TokenSearchRequest request, TokenOutputOptions options) {
        String filter = SearchFilterBuilder.tokens()
                .criteria(request.getCriteria())
                .equal(TokenAttributes.TOKEN_ID, request.getId())
                .equal(TokenAttributes.OWNER, ownerResolver.normalizeOwner(request.getOwner()))
                .equal(TokenAttributes.DESCRIPTION, request.getDescription())
                .equal(TokenAttributes.DISABLED, request.getDisabled() != null
                        ? TokenSchemaResolver.formatBoolean(request.getDisabled())
                        : null)
                .equal(TokenAttributes.VENDOR, request.getVendor())
                .equal(TokenAttributes.MODEL, request.getModel())
                .equal(TokenAttributes.SERIAL, request.getSerial())
                .build();
        filter = SearchFilterRewriter.rewrite(filter, request.getType());
        log.debug("[OtpToken] Searching with filter {}", filter);

        DirectorySearchResult result = directoryPort.search(filter, properties.getSearch().getSizeLimit());
        List<TokenView> views = result.entries().stream()
                .map(entry -> present(entry, options))
                .toList();
        return TokenSearchResult.builder()
                .tokens(views)
                .count(views.size())
                .truncated(result.truncated())
                .build();
    }

    public ManagerUpdateResult addManagers(String id, List<String> users, TokenOutputOptions options) {
        DirectoryEntry stored = directoryPort.read(id);
        List<String> managers = new ArrayList<>(stored.get(TokenAttributes.MANAGED_BY));
        Map<String, String> failed = new LinkedHashMap<>();
        int completed = 0;

        for (String uid : users) {
            Optional<UserIdentity> user = identityPort.findUser(uid);
            if (user.isEmpty()) {
                failed.put(uid, "no such entry");
            } else if (managers.contains(user.get().reference())) {
                failed.put(uid, "This entry is already a member");
            } else {
                managers.add(user.get().reference());
                completed++;
            }
        }
        return applyManagers(id, stored, managers, completed, failed, options);
    }

    public ManagerUpdateResult removeManagers(String id, List<String> users, TokenOutputOptions options) {
        DirectoryEntry stored = directoryPort.read(id);
        List<String> managers = new ArrayList<>(stored.get(TokenAttributes.MANAGED_BY));
        Map<String, String> failed = new LinkedHashMap<>();
        int completed = 0;

        for (String uid : users) {
            Optional<UserIdentity> user = identityPort.findUser(uid);
            if (user.isEmpty() || !managers.remove(user.get().reference())) {
                failed.put(uid, "This entry is not a member");
            } else {
                completed++;
            }
        }
        return applyManagers(id, stored, managers, completed, failed, options);
    }

    private ManagerUpdateResult applyManagers(String id, DirectoryEntry stored, List<String> managers,
            int completed, Map<String, String> failed, TokenOutputOptions options) {
        DirectoryEntry entry = stored;
        if (completed > 0) {
            entry = directoryPort.update(id, new DirectoryEntry().put(TokenAttributes.MANAGED_BY, managers));
            log.info("[OtpToken] Token {} managers changed ({} completed, {} failed)", id, completed,
                    failed.size());
        }
        return ManagerUpdateResult.builder()
                .token(present(entry, options))
                .completed(completed)
                .failed(failed)
                .build();
    }

    private TokenCreation prepare(TokenCreateRequest request, String caller) {
        String id = request.getId() == null || request.getId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getId();

        validityValidator.validateCreate(request.getNotBefore(), request.getNotAfter());

        TokenType type = TokenType.fromValue(request.getType() != null ? request.getType() : DEFAULT_TYPE);
        TokenParameters parameters = schemaResolver.resolveParameters(type, request);
        TokenAlgorithm algorithm = TokenAlgorithm.fromValue(request.getAlgorithm());
        int digits = resolveDigits(request.getDigits());
        byte[] key = keyCodec.resolve(request.getKey());

        List<String> managedBy = request.getManagedBy() != null ? resolveManagers(request.getManagedBy()) : null;
        TokenOwnerResolver.Assignment assignment = ownerResolver.applyCreateDefaults(
                request.getOwner(), managedBy, caller);
        String owner = ownerResolver.normalizeOwner(assignment.owner());

        Map<TokenInfoField, String> info = new EnumMap<>(TokenInfoField.class);
        putInfo(info, TokenInfoField.DESCRIPTION, request.getDescription());
        putInfo(info, TokenInfoField.VENDOR, request.getVendor());
        putInfo(info, TokenInfoField.MODEL, request.getModel());
        putInfo(info, TokenInfoField.SERIAL, request.getSerial());

        OtpToken token = OtpToken.builder()
                .id(id)
                .key(key)
                .algorithm(algorithm)
                .digits(digits)
                .parameters(parameters)
                .owner(owner)
                .managedBy(assignment.managedBy() != null ? assignment.managedBy() : List.of())
                .disabled(Boolean.TRUE.equals(request.getDisabled()))
                .notBefore(request.getNotBefore())
                .notAfter(request.getNotAfter())
                .info(info)
                .build();

        return new TokenCreation(token, uriBuilder.build(token));
    }

    private TokenView present(DirectoryEntry entry, TokenOutputOptions options) {
        TokenView view = schemaResolver.toView(entry, options);
        return ownerResolver.denormalize(view, options.isRaw());
    }

    private List<String> resolveManagers(List<String> users) {
        return users.stream()
                .map(ownerResolver::normalizeOwner)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    private static int resolveDigits(Integer digits) {
        if (digits == null) {
            return 6;
        }
        if (!ALLOWED_DIGITS.contains(digits)) {
            throw new TokenValidationException("digits", "must be one of: 6, 8");
        }
        return digits;
    }

    private static void putInfo(Map<TokenInfoField, String> info, TokenInfoField field, String value) {
        if (value != null) {
            info.put(field, value);
        }
    }
}

package me.golemcore.otp.adapter.outbound.identity;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.domain.model.UserIdentity;
import me.golemcore.otp.infrastructure.config.OtpProperties;
import me.golemcore.otp.port.outbound.IdentityPort;
import me.golemcore.otp.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * File-backed user directory. Each user is a JSON document
 * {@code users/<uid>.json} holding {@code uid} and an optional
 * {@code principalName}.
 */
@Component
@Slf4j
public class LocalIdentityAdapter implements IdentityPort {

    private static final String UID_PREFIX = "uid=";
    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;
    private final OtpProperties properties;
    private final ObjectMapper objectMapper;

    public LocalIdentityAdapter(StoragePort storagePort, OtpProperties properties) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = new ObjectMapper();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UserRecord(String uid, String principalName) {
    }

    @Override
    public Optional<UserIdentity> findUser(String uid) {
        if (uid == null || uid.isBlank()) {
            return Optional.empty();
        }
        String identifier = toIdentifier(uid);
        return load(identifier).map(user -> new UserIdentity(user.uid(), referenceOf(user.uid())));
    }

    @Override
    public String resolveIdentity(String uid) {
        return findUser(uid)
                .map(UserIdentity::reference)
                .orElseThrow(() -> NotFoundException.user(uid));
    }

    @Override
    public String toIdentifier(String reference) {
        if (!isUserReference(reference)) {
            return reference;
        }
        return reference.substring(UID_PREFIX.length(), reference.indexOf(','));
    }

    @Override
    public Optional<String> lookupAttribute(String reference, String attribute) {
        String uid = toIdentifier(reference);
        UserRecord user = load(uid).orElseThrow(() -> NotFoundException.user(uid));
        switch (attribute.toLowerCase(Locale.ROOT)) {
        case "uid":
            return Optional.ofNullable(user.uid());
        case TokenAttributes.PRINCIPAL_NAME:
            return Optional.ofNullable(user.principalName());
        default:
            return Optional.empty();
        }
    }

    String referenceOf(String uid) {
        return UID_PREFIX + uid + "," + usersSuffix();
    }

    private boolean isUserReference(String value) {
        return value != null
                && value.toLowerCase(Locale.ROOT).startsWith(UID_PREFIX)
                && value.toLowerCase(Locale.ROOT).endsWith("," + usersSuffix().toLowerCase(Locale.ROOT));
    }

    private String usersSuffix() {
        return "cn=users,cn=accounts," + properties.getBaseDn();
    }

    private Optional<UserRecord> load(String uid) {
        if (uid.contains("/") || uid.contains("\\") || uid.startsWith(".")) {
            return Optional.empty();
        }
        String directory = properties.getStorage().getDirectories().getUsers();
        String json = storagePort.getText(directory, uid + EXTENSION).join();
        if (json == null) {
            return Optional.empty();
        }
        try {
            UserRecord user = objectMapper.readValue(json, UserRecord.class);
            return Optional.of(user.uid() != null ? user : new UserRecord(uid, user.principalName()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted user entry " + uid, e);
        }
    }
}

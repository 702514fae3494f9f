package me.golemcore.otp.adapter.outbound.directory;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.domain.exception.DuplicateEntryException;
import me.golemcore.otp.domain.exception.NotFoundException;
import me.golemcore.otp.domain.model.DirectoryEntry;
import me.golemcore.otp.domain.model.DirectorySearchResult;
import me.golemcore.otp.domain.model.TokenAttributes;
import me.golemcore.otp.infrastructure.config.OtpProperties;
import me.golemcore.otp.port.outbound.StoragePort;
import me.golemcore.otp.port.outbound.TokenDirectoryPort;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * File-backed token directory. Every token is one JSON document in the
 * {@code tokens} storage directory, keyed by its id.
 *
 * <p>
 * Writes go through {@link StoragePort#putTextAtomic} with a backup of the
 * previous version. Mutations are serialized on this adapter.
 */
@Component
@Slf4j
public class LocalTokenDirectoryAdapter implements TokenDirectoryPort {

    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;
    private final OtpProperties properties;
    private final ObjectMapper objectMapper;

    public LocalTokenDirectoryAdapter(StoragePort storagePort, OtpProperties properties) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public synchronized DirectoryEntry create(DirectoryEntry entry) {
        String id = entry.getSingle(TokenAttributes.TOKEN_ID);
        if (id == null) {
            throw new IllegalArgumentException("Token entry has no " + TokenAttributes.TOKEN_ID);
        }
        if (Boolean.TRUE.equals(storagePort.exists(directory(), fileName(id)).join())) {
            throw new DuplicateEntryException(id);
        }
        write(id, entry);
        log.debug("[Directory] Created entry {}", referenceOf(id));
        return entry.copy();
    }

    @Override
    public DirectoryEntry read(String id) {
        String json = storagePort.getText(directory(), fileName(id)).join();
        if (json == null) {
            throw NotFoundException.token(id);
        }
        return parse(id, json);
    }

    @Override
    public synchronized DirectoryEntry update(String id, DirectoryEntry changes) {
        DirectoryEntry entry = read(id);
        for (String name : changes.names()) {
            List<String> values = changes.get(name);
            if (values.isEmpty()) {
                entry.remove(name);
            } else {
                entry.put(name, values);
            }
        }
        write(id, entry);
        log.debug("[Directory] Modified entry {}: {}", referenceOf(id), changes.names());
        return entry;
    }

    @Override
    public synchronized void delete(String id) {
        if (!Boolean.TRUE.equals(storagePort.exists(directory(), fileName(id)).join())) {
            throw NotFoundException.token(id);
        }
        storagePort.deleteObject(directory(), fileName(id)).join();
        log.debug("[Directory] Deleted entry {}", referenceOf(id));
    }

    @Override
    public DirectorySearchResult search(String filter, int sizeLimit) {
        Predicate<DirectoryEntry> predicate = DirectoryFilterMatcher.compile(filter);
        List<DirectoryEntry> matches = new ArrayList<>();

        for (String file : storagePort.listObjects(directory(), "").join()) {
            if (!file.endsWith(EXTENSION)) {
                continue;
            }
            String json = storagePort.getText(directory(), file).join();
            if (json == null) {
                continue;
            }
            DirectoryEntry entry = parse(file, json);
            if (predicate.test(entry)) {
                matches.add(entry);
            }
        }

        matches.sort(Comparator.comparing(entry -> entry.getSingle(TokenAttributes.TOKEN_ID),
                Comparator.nullsLast(Comparator.naturalOrder())));
        boolean truncated = sizeLimit > 0 && matches.size() > sizeLimit;
        if (truncated) {
            log.debug("[Directory] Search {} truncated to {} of {} entries", filter, sizeLimit, matches.size());
            return new DirectorySearchResult(List.copyOf(matches.subList(0, sizeLimit)), true);
        }
        return new DirectorySearchResult(List.copyOf(matches), false);
    }

    @Override
    public String referenceOf(String id) {
        return TokenAttributes.TOKEN_ID + "=" + id + ",cn=otp," + properties.getBaseDn();
    }

    private void write(String id, DirectoryEntry entry) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entry);
            storagePort.putTextAtomic(directory(), fileName(id), json, true).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize token entry " + id, e);
        }
    }

    private DirectoryEntry parse(String source, String json) {
        try {
            return objectMapper.readValue(json, DirectoryEntry.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted token entry " + source, e);
        }
    }

    private String directory() {
        return properties.getStorage().getDirectories().getTokens();
    }

    static String fileName(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8) + EXTENSION;
    }
}

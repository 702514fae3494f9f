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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flat, multi-valued attribute map exchanged with the directory store.
 *
 * <p>
 * Attribute names are case-insensitive and kept lower-case. In an update, an
 * attribute mapped to an empty list means "remove this attribute".
 */
public class DirectoryEntry {

    private final Map<String, List<String>> attributes = new TreeMap<>();

    public DirectoryEntry() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public DirectoryEntry(Map<String, List<String>> attributes) {
        if (attributes != null) {
            attributes.forEach(this::put);
        }
    }

    public DirectoryEntry copy() {
        return new DirectoryEntry(attributes);
    }

    public DirectoryEntry put(String name, List<String> values) {
        attributes.put(normalize(name), values == null ? List.of() : List.copyOf(values));
        return this;
    }

    public DirectoryEntry put(String name, String value) {
        return put(name, value == null ? List.of() : List.of(value));
    }

    public List<String> get(String name) {
        return attributes.getOrDefault(normalize(name), List.of());
    }

    /**
     * First value of an attribute, or {@code null} when absent or empty.
     */
    public String getSingle(String name) {
        List<String> values = get(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public boolean contains(String name) {
        return attributes.containsKey(normalize(name));
    }

    public List<String> remove(String name) {
        return attributes.remove(normalize(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(attributes.keySet());
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    @JsonValue
    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(attributes);
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DirectoryEntry)) {
            return false;
        }
        return attributes.equals(((DirectoryEntry) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        Map<String, Object> printable = new TreeMap<>(attributes);
        if (printable.containsKey(TokenAttributes.KEY)) {
            printable.put(TokenAttributes.KEY, "********");
        }
        return "DirectoryEntry" + printable;
    }
}

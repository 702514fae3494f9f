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

import me.golemcore.otp.domain.model.DirectoryEntry;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Compiles an RFC 4515 search filter into a predicate over directory entries.
 *
 * <p>
 * Supports {@code &}, {@code |}, {@code !}, equality, presence and substring
 * items. Attribute names and values are compared case-insensitively.
 */
public final class DirectoryFilterMatcher {

    private final String filter;
    private int pos;

    private DirectoryFilterMatcher(String filter) {
        this.filter = filter;
    }

    /**
     * @throws IllegalArgumentException
     *             when the filter is malformed
     */
    public static Predicate<DirectoryEntry> compile(String filter) {
        if (filter == null || filter.isBlank()) {
            throw new IllegalArgumentException("Empty search filter");
        }
        DirectoryFilterMatcher parser = new DirectoryFilterMatcher(filter.trim());
        Predicate<DirectoryEntry> predicate = parser.parseFilter();
        if (parser.pos != parser.filter.length()) {
            throw parser.error("unexpected trailing characters");
        }
        return predicate;
    }

    private Predicate<DirectoryEntry> parseFilter() {
        expect('(');
        if (pos >= filter.length()) {
            throw error("unterminated filter");
        }
        Predicate<DirectoryEntry> predicate;
        char c = filter.charAt(pos);
        if (c == '&') {
            pos++;
            List<Predicate<DirectoryEntry>> parts = parseList();
            predicate = entry -> parts.stream().allMatch(p -> p.test(entry));
        } else if (c == '|') {
            pos++;
            List<Predicate<DirectoryEntry>> parts = parseList();
            predicate = entry -> parts.stream().anyMatch(p -> p.test(entry));
        } else if (c == '!') {
            pos++;
            predicate = parseFilter().negate();
        } else {
            predicate = parseItem();
        }
        expect(')');
        return predicate;
    }

    private List<Predicate<DirectoryEntry>> parseList() {
        List<Predicate<DirectoryEntry>> parts = new ArrayList<>();
        while (pos < filter.length() && filter.charAt(pos) == '(') {
            parts.add(parseFilter());
        }
        if (parts.isEmpty()) {
            throw error("empty filter list");
        }
        return parts;
    }

    private Predicate<DirectoryEntry> parseItem() {
        int eq = filter.indexOf('=', pos);
        int close = filter.indexOf(')', pos);
        if (eq < 0 || close < 0 || eq > close) {
            throw error("missing '=' in filter item");
        }
        String attribute = filter.substring(pos, eq).trim().toLowerCase(Locale.ROOT);
        if (attribute.isEmpty()) {
            throw error("missing attribute name");
        }
        char last = attribute.charAt(attribute.length() - 1);
        if (last == '>' || last == '<' || last == '~') {
            throw error("unsupported match type '" + last + "='");
        }
        String rawValue = filter.substring(eq + 1, close);
        pos = close;

        if ("*".equals(rawValue)) {
            return entry -> entry.contains(attribute);
        }
        if (rawValue.indexOf('*') < 0) {
            String expected = unescape(rawValue);
            return entry -> entry.get(attribute).stream().anyMatch(v -> v.equalsIgnoreCase(expected));
        }
        List<String> parts = new ArrayList<>();
        for (String part : rawValue.split("\\*", -1)) {
            parts.add(unescape(part).toLowerCase(Locale.ROOT));
        }
        return entry -> entry.get(attribute).stream().anyMatch(v -> matchesSubstring(v, parts));
    }

    private static boolean matchesSubstring(String value, List<String> parts) {
        String candidate = value.toLowerCase(Locale.ROOT);
        String initial = parts.get(0);
        String fin = parts.get(parts.size() - 1);
        if (!candidate.startsWith(initial)) {
            return false;
        }
        int index = initial.length();
        for (int i = 1; i < parts.size() - 1; i++) {
            int found = candidate.indexOf(parts.get(i), index);
            if (found < 0) {
                return false;
            }
            index = found + parts.get(i).length();
        }
        return candidate.length() - fin.length() >= index && candidate.endsWith(fin);
    }

    private String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int i = 0;
        while (i < value.length()) {
            int c = value.codePointAt(i);
            if (c == '\\') {
                if (i + 2 >= value.length()) {
                    throw error("truncated escape sequence");
                }
                try {
                    out.write(Integer.parseInt(value.substring(i + 1, i + 3), 16));
                } catch (NumberFormatException e) {
                    throw error("invalid escape sequence");
                }
                i += 3;
            } else {
                byte[] bytes = new String(Character.toChars(c)).getBytes(StandardCharsets.UTF_8);
                out.write(bytes, 0, bytes.length);
                i += Character.charCount(c);
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private void expect(char c) {
        if (pos >= filter.length() || filter.charAt(pos) != c) {
            throw error("expected '" + c + "'");
        }
        pos++;
    }

    private IllegalArgumentException error(String reason) {
        return new IllegalArgumentException("Bad search filter " + filter + ": " + reason + " at " + pos);
    }
}

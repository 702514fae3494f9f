package me.golemcore.otp.domain.service;

import me.golemcore.otp.domain.model.TokenAttributes;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles RFC 4515 search filters for token searches.
 *
 * <p>
 * The result always starts with the generic token predicate, followed by an
 * OR over substring matches of the free-text criteria and by one equality
 * predicate per attribute option.
 */
public final class SearchFilterBuilder {

    private static final List<String> CRITERIA_ATTRIBUTES = List.of(
            TokenAttributes.TOKEN_ID,
            TokenAttributes.DESCRIPTION,
            TokenAttributes.VENDOR,
            TokenAttributes.MODEL,
            TokenAttributes.SERIAL);

    private final List<String> predicates = new ArrayList<>();

    private SearchFilterBuilder() {
        predicates.add(SearchFilterRewriter.GENERIC_PREDICATE);
    }

    public static SearchFilterBuilder tokens() {
        return new SearchFilterBuilder();
    }

    public SearchFilterBuilder criteria(String criteria) {
        if (criteria == null || criteria.isBlank()) {
            return this;
        }
        String escaped = escape(criteria.trim());
        StringBuilder or = new StringBuilder("(|");
        for (String attribute : CRITERIA_ATTRIBUTES) {
            or.append('(').append(attribute).append("=*").append(escaped).append("*)");
        }
        predicates.add(or.append(')').toString());
        return this;
    }

    public SearchFilterBuilder equal(String attribute, String value) {
        if (value != null) {
            predicates.add("(" + attribute + "=" + escape(value) + ")");
        }
        return this;
    }

    public String build() {
        if (predicates.size() == 1) {
            return predicates.get(0);
        }
        return "(&" + String.join("", predicates) + ")";
    }

    /**
     * Escape a value for use inside a filter assertion.
     */
    public static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
            case '\\' -> sb.append("\\5c");
            case '*' -> sb.append("\\2a");
            case '(' -> sb.append("\\28");
            case ')' -> sb.append("\\29");
            case '\0' -> sb.append("\\00");
            default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}

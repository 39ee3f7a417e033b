/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import com.taillens.common.exception.InvalidQueryException;
import com.taillens.server.cache.RecordFields;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation of caller-supplied query parameters. Everything a request layer receives
 * as text passes through here before it reaches the cache; bad input is rejected with
 * an {@link InvalidQueryException} naming the parameter.
 */
public final class QueryParams {

    /** Level names accepted in a level filter (compared case-insensitively). */
    public static final Set<String> KNOWN_LEVELS = Set.of(
            "TRACE", "DEBUG", "INFO", "NOTICE", "WARN", "WARNING",
            "ERROR", "CRITICAL", "FATAL", RecordFields.UNKNOWN_LEVEL);

    private static final Pattern CATEGORY = Pattern.compile("[\\w\\-<>$]+(\\.[\\w\\-<>$]+)*");

    private QueryParams() {}

    /**
     * Parse an optional non-negative id.
     *
     * @return the id, or {@code null} when the parameter is absent or blank
     */
    public static Long parseId(String name, String raw) {
        if (raw == null || raw.isBlank()) return null;
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException(name, "'" + raw + "' is not an integer id");
        }
        if (value < 0) {
            throw new InvalidQueryException(name, "must be >= 0, got " + value);
        }
        return value;
    }

    /** Parse a page size, falling back to {@code defaultLimit} when absent. */
    public static int parseLimit(String name, String raw, int defaultLimit, int maxPageSize) {
        if (raw == null || raw.isBlank()) return Math.min(defaultLimit, maxPageSize);
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException(name, "'" + raw + "' is not an integer");
        }
        if (value < 1 || value > maxPageSize) {
            throw new InvalidQueryException(name, "must be between 1 and " + maxPageSize + ", got " + value);
        }
        return value;
    }

    /** Upper-cased level names; unknown names are rejected. */
    public static Set<String> parseLevels(String name, Collection<String> raw) {
        Set<String> levels = new LinkedHashSet<>();
        if (raw == null) return levels;
        for (String value : raw) {
            if (value == null || value.isBlank()) continue;
            String level = value.trim().toUpperCase(Locale.ROOT);
            if (!KNOWN_LEVELS.contains(level)) {
                throw new InvalidQueryException(name, "unknown level '" + value.trim() + "'");
            }
            levels.add(level);
        }
        return levels;
    }

    /** Dotted category paths; malformed paths are rejected. */
    public static Set<String> parseCategories(String name, Collection<String> raw) {
        Set<String> categories = new LinkedHashSet<>();
        if (raw == null) return categories;
        for (String value : raw) {
            if (value == null || value.isBlank()) continue;
            String category = value.trim();
            if (!CATEGORY.matcher(category).matches()) {
                throw new InvalidQueryException(name, "malformed category path '" + category + "'");
            }
            categories.add(category);
        }
        return categories;
    }
}

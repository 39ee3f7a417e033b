/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import com.taillens.common.model.LogRecord;
import com.taillens.server.cache.RecordFields;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Level and category filter. An empty set places no restriction on that dimension;
 * a record without a category never matches a non-empty category set.
 *
 * @param levels     upper-case level names
 * @param categories exact dotted category paths
 */
public record LogFilter(Set<String> levels, Set<String> categories, RecordFields fields)
        implements Predicate<LogRecord> {

    public LogFilter {
        levels = Set.copyOf(levels);
        categories = Set.copyOf(categories);
    }

    public static LogFilter none(RecordFields fields) {
        return new LogFilter(Set.of(), Set.of(), fields);
    }

    public boolean isEmpty() {
        return levels.isEmpty() && categories.isEmpty();
    }

    @Override
    public boolean test(LogRecord record) {
        if (!levels.isEmpty() && !levels.contains(fields.levelOf(record))) {
            return false;
        }
        return categories.isEmpty()
                || fields.categoryOf(record).map(categories::contains).orElse(false);
    }

    /** This filter, or {@code null} when it matches everything (cheaper for the cache). */
    Predicate<LogRecord> orNull() {
        return isEmpty() ? null : this;
    }
}

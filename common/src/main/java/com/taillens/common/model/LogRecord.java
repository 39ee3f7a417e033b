/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.model;

import java.util.Map;
import java.util.Optional;

/**
 * One decoded line of the watched log file.
 *
 * <p>A line is either a {@link StructuredRecord} (it decoded as a JSON object) or a
 * {@link RawRecord} (anything else, kept verbatim). Both variants answer field lookups,
 * so filters and indexers never need to know which one they hold.</p>
 */
public sealed interface LogRecord permits StructuredRecord, RawRecord {

    /** Value of a top-level field, empty when absent or null. */
    Optional<Object> field(String name);

    /** Field value rendered as a string, empty when absent, null or blank. */
    default Optional<String> text(String name) {
        return field(name)
                .map(String::valueOf)
                .filter(s -> !s.isBlank());
    }

    /** Wire form of the record, without the cache-assigned id. */
    Map<String, Object> toMap();
}

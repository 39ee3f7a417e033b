/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A record admitted to the cache together with the id it was assigned.
 * Serializes as the record's fields plus {@code "_id"}.
 */
public record LogEntry(long id, LogRecord record) {

    public static final String ID_FIELD = "_id";

    public LogEntry {
        Objects.requireNonNull(record, "record");
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(record.toMap());
        map.put(ID_FIELD, id);
        return map;
    }
}

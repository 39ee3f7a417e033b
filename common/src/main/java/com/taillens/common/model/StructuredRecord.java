/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A line that decoded as a JSON object. Members keep their document order.
 */
public record StructuredRecord(Map<String, Object> fields) implements LogRecord {

    public StructuredRecord {
        // JSON null members are legal, so Map.copyOf is not an option
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public Optional<Object> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    @Override
    public Map<String, Object> toMap() {
        return fields;
    }
}

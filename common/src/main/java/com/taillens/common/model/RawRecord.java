/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fallback for a line that is not a JSON object: the original text plus the wall-clock
 * time it was decoded.
 */
public record RawRecord(String text, Instant ingestedAt) implements LogRecord {

    public static final String RAW_FIELD = "raw";
    public static final String INGESTED_AT_FIELD = "ingested_at";

    public RawRecord {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(ingestedAt, "ingestedAt");
    }

    @Override
    public Optional<Object> field(String name) {
        return switch (name) {
            case RAW_FIELD -> Optional.of(text);
            case INGESTED_AT_FIELD -> Optional.of(epochSeconds());
            default -> Optional.empty();
        };
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(RAW_FIELD, text);
        map.put(INGESTED_AT_FIELD, epochSeconds());
        return map;
    }

    /** Epoch seconds with millisecond fraction. */
    private double epochSeconds() {
        return ingestedAt.toEpochMilli() / 1000.0;
    }
}

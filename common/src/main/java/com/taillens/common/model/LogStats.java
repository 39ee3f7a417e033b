/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts over the resident entries matching a filter. Count maps are
 * sorted by key.
 */
public record LogStats(
        @JsonProperty("totalEntries") long totalEntries,
        @JsonProperty("levelCounts") Map<String, Long> levelCounts,
        @JsonProperty("categoryCounts") Map<String, Long> categoryCounts) {

    public LogStats {
        levelCounts = Collections.unmodifiableMap(new TreeMap<>(levelCounts));
        categoryCounts = Collections.unmodifiableMap(new TreeMap<>(categoryCounts));
    }
}

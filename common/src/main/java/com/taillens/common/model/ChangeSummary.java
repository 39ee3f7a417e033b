/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to "is there anything newer than id X?".
 *
 * @param hasUpdates resident entries newer than the caller's id exist
 * @param newCount   how many, clamped to what is resident
 * @param minId      oldest resident id, {@code -1} when the cache is empty
 * @param maxId      newest resident id, {@code -1} when the cache is empty
 */
public record ChangeSummary(
        @JsonProperty("has_updates") boolean hasUpdates,
        @JsonProperty("new_count") long newCount,
        @JsonProperty("min_id") long minId,
        @JsonProperty("max_id") long maxId) {

    private static final ChangeSummary EMPTY = new ChangeSummary(false, 0, -1, -1);

    public static ChangeSummary empty() { return EMPTY; }
}

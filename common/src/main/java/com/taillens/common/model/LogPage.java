/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of a paginated log query.
 *
 * @param logs    entries in ascending id order
 * @param total   resident entries matching the query's filter
 * @param start   first id the query asked for
 * @param limit   maximum page size the query asked for
 * @param hasMore true iff the last returned id is below the newest resident id
 */
public record LogPage(
        @JsonProperty("logs") List<LogEntry> logs,
        @JsonProperty("total") long total,
        @JsonProperty("start") long start,
        @JsonProperty("limit") int limit,
        @JsonProperty("hasMore") boolean hasMore) {

    public LogPage {
        logs = List.copyOf(logs);
    }
}

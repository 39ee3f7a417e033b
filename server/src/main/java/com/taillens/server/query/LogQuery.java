/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import java.util.Objects;

/**
 * A validated page request.
 *
 * @param startId first id wanted, {@code null} for "the newest {@code limit} records"
 * @param limit   page size, at least 1
 * @param filter  level/category filter
 */
public record LogQuery(Long startId, int limit, LogFilter filter) {

    public LogQuery {
        Objects.requireNonNull(filter, "filter");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        if (startId != null && startId < 0) {
            throw new IllegalArgumentException("startId must be >= 0, got " + startId);
        }
    }

    public boolean isLatest() {
        return startId == null;
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import com.taillens.common.model.ChangeSummary;
import com.taillens.common.model.LogEntry;
import com.taillens.common.model.LogPage;
import com.taillens.common.model.LogRecord;
import com.taillens.common.model.LogStats;
import com.taillens.server.cache.EntryCache;
import com.taillens.server.cache.RecordFields;
import com.taillens.server.cursor.ReadCursor;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Read API of the engine, as consumed by a request layer.
 *
 * <ul>
 *   <li><b>Pull</b>: {@link #getLogs(LogQuery)} pages through the window by id.</li>
 *   <li><b>Change detection</b>: {@link #changesSince(long)} tells a poller whether a
 *       fetch is worth it.</li>
 *   <li><b>Push</b>: {@link #openStream} returns a {@link LogStream} the transport ticks
 *       on its own schedule.</li>
 * </ul>
 *
 * Only reads the cache; holds no per-reader state.
 */
public class LogQueryService {

    private final EntryCache cache;
    private final RecordFields fields;

    public LogQueryService(EntryCache cache) {
        this.cache = cache;
        this.fields = cache.fields();
    }

    /** Filter over this cache's record fields. */
    public LogFilter filter(Set<String> levels, Set<String> categories) {
        return new LogFilter(levels, categories, fields);
    }

    /**
     * One page of entries. Without a start id the page holds the newest
     * {@code limit} matching entries. {@code total} counts every resident match;
     * {@code hasMore} is true iff the last returned id is below the newest resident id.
     */
    public LogPage getLogs(LogQuery query) {
        Predicate<LogRecord> predicate = query.filter().orNull();
        return cache.atomically(() -> {
            List<LogEntry> logs = query.isLatest()
                    ? cache.tail(query.limit(), predicate)
                    : cache.get(query.startId(), query.limit(), predicate);
            long total = cache.count(predicate);
            long maxId = cache.maxId();
            boolean hasMore = !logs.isEmpty() && logs.get(logs.size() - 1).id() < maxId;
            long start = query.isLatest()
                    ? (logs.isEmpty() ? cache.lastAssignedId() + 1 : logs.get(0).id())
                    : query.startId();
            return new LogPage(logs, total, start, query.limit(), hasMore);
        });
    }

    /** Copy of the category tree, keyed by parent path ({@code root} at the top). */
    public Map<String, Set<String>> getModuleHierarchy() {
        return cache.hierarchySnapshot();
    }

    /** Level and category counts over the resident entries matching {@code filter}. */
    public LogStats getStats(LogFilter filter) {
        List<LogEntry> entries = cache.get(Long.MIN_VALUE, Integer.MAX_VALUE, filter.orNull());
        Map<String, Long> levelCounts = new HashMap<>();
        Map<String, Long> categoryCounts = new HashMap<>();
        for (LogEntry entry : entries) {
            levelCounts.merge(fields.levelOf(entry.record()), 1L, Long::sum);
            fields.categoryOf(entry.record())
                    .ifPresent(category -> categoryCounts.merge(category, 1L, Long::sum));
        }
        return new LogStats(entries.size(), levelCounts, categoryCounts);
    }

    public ChangeSummary changesSince(long lastKnownId) {
        return cache.changesSince(lastKnownId);
    }

    /**
     * @param lastKnownId last id the caller already has, or {@code null} to receive
     *                    only records admitted from now on
     */
    public ReadCursor openCursor(Long lastKnownId) {
        return lastKnownId == null
                ? ReadCursor.openAt(cache)
                : ReadCursor.resumeAfter(cache, lastKnownId);
    }

    /** Entries newer than the cursor, advancing it. Rebases first after a rotation. */
    public List<LogEntry> readNew(ReadCursor cursor, int maxCount) {
        return cursor.read(cache, maxCount, null);
    }

    public boolean hasUpdates(ReadCursor cursor) {
        return cursor.hasUpdates(cache);
    }

    /**
     * Push-style reader over a new cursor.
     *
     * @param batchSize         maximum entries handed to the listener per call
     * @param heartbeatInterval idle time after which a heartbeat is emitted
     */
    public LogStream openStream(Long lastKnownId, LogStreamListener listener,
                                int batchSize, Duration heartbeatInterval) {
        return new LogStream(this, openCursor(lastKnownId), listener, batchSize,
                heartbeatInterval, Clock.systemUTC());
    }
}

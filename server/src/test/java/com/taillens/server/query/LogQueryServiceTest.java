/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import com.taillens.common.model.ChangeSummary;
import com.taillens.common.model.LogPage;
import com.taillens.common.model.LogStats;
import com.taillens.common.model.RawRecord;
import com.taillens.server.cache.EntryCache;
import com.taillens.server.cache.RecordFields;
import com.taillens.server.cursor.ReadCursor;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.taillens.server.TestRecords.*;
import static org.junit.jupiter.api.Assertions.*;

class LogQueryServiceTest {

    private static LogQueryService serviceWith(int capacity, int count) {
        EntryCache cache = new EntryCache(capacity, RecordFields.DEFAULT);
        for (int i = 0; i < count; i++) cache.admit(record("m" + i));
        return new LogQueryService(cache);
    }

    private static LogQuery page(Long start, int limit) {
        return new LogQuery(start, limit, LogFilter.none(RecordFields.DEFAULT));
    }

    @Test
    void evictedScenarioReturnsResidentWindow() {
        EntryCache cache = new EntryCache(3, RecordFields.DEFAULT);
        for (String m : List.of("A", "B", "C", "D")) cache.admit(record(m));
        LogQueryService service = new LogQueryService(cache);

        LogPage result = service.getLogs(page(0L, 10));

        assertEquals(List.of("B", "C", "D"), messages(result.logs()));
        assertEquals(List.of(1L, 2L, 3L), ids(result.logs()));
        assertEquals(3, result.total());
        assertFalse(result.hasMore());
        assertEquals(0, result.start());
    }

    @Test
    void pagesCoverTheWindow() {
        LogQueryService service = serviceWith(100, 10);

        LogPage first = service.getLogs(page(0L, 4));
        LogPage second = service.getLogs(page(4L, 4));
        LogPage third = service.getLogs(page(8L, 4));

        assertEquals(List.of(0L, 1L, 2L, 3L), ids(first.logs()));
        assertTrue(first.hasMore());
        assertEquals(List.of(4L, 5L, 6L, 7L), ids(second.logs()));
        assertTrue(second.hasMore());
        assertEquals(List.of(8L, 9L), ids(third.logs()));
        assertFalse(third.hasMore());
        assertEquals(10, third.total());
        assertEquals(4, third.limit());
    }

    @Test
    void withoutStartIdReturnsNewest() {
        LogQueryService service = serviceWith(100, 10);

        LogPage latest = service.getLogs(page(null, 3));

        assertEquals(List.of(7L, 8L, 9L), ids(latest.logs()));
        assertEquals(7, latest.start());
        assertFalse(latest.hasMore());
    }

    @Test
    void emptyCacheYieldsEmptyPage() {
        LogQueryService service = serviceWith(100, 0);

        LogPage latest = service.getLogs(page(null, 10));

        assertTrue(latest.logs().isEmpty());
        assertEquals(0, latest.total());
        assertEquals(0, latest.start());
        assertFalse(latest.hasMore());
    }

    @Test
    void levelAndCategoryFilters() {
        EntryCache cache = new EntryCache(100, RecordFields.DEFAULT);
        cache.admit(record("a", "INFO", "auth", "login"));
        cache.admit(record("b", "ERROR", "auth", "login"));
        cache.admit(record("c", "ERROR", "db", null));
        cache.admit(record("d", "info", "auth", "logout"));
        LogQueryService service = new LogQueryService(cache);

        LogPage errors = service.getLogs(new LogQuery(0L, 10, service.filter(Set.of("ERROR"), Set.of())));
        assertEquals(List.of("b", "c"), messages(errors.logs()));
        assertEquals(2, errors.total());

        LogPage login = service.getLogs(new LogQuery(null, 10, service.filter(Set.of(), Set.of("auth.login"))));
        assertEquals(List.of("a", "b"), messages(login.logs()));
        assertTrue(login.hasMore());

        LogPage both = service.getLogs(new LogQuery(0L, 10,
                service.filter(Set.of("INFO"), Set.of("auth.login", "auth.logout"))));
        assertEquals(List.of("a", "d"), messages(both.logs()));
    }

    @Test
    void statsCountLevelsAndCategories() {
        EntryCache cache = new EntryCache(100, RecordFields.DEFAULT);
        cache.admit(record("a", "INFO", "auth", "login"));
        cache.admit(record("b", "ERROR", "auth", "login"));
        cache.admit(record("c", "error", "db", null));
        cache.admit(new RawRecord("plain", Instant.EPOCH));
        LogQueryService service = new LogQueryService(cache);

        LogStats stats = service.getStats(LogFilter.none(RecordFields.DEFAULT));
        assertEquals(4, stats.totalEntries());
        assertEquals(Map.of("INFO", 1L, "ERROR", 2L, "UNKNOWN", 1L), stats.levelCounts());
        assertEquals(Map.of("auth.login", 2L, "db", 1L), stats.categoryCounts());

        LogStats errorStats = service.getStats(service.filter(Set.of("ERROR"), Set.of()));
        assertEquals(2, errorStats.totalEntries());
        assertEquals(Map.of("ERROR", 2L), errorStats.levelCounts());
    }

    @Test
    void moduleHierarchyAndChanges() {
        EntryCache cache = new EntryCache(100, RecordFields.DEFAULT);
        cache.admit(record("a", "INFO", "auth", "login"));
        cache.admit(record("b", "INFO", "auth", "logout"));
        LogQueryService service = new LogQueryService(cache);

        Map<String, Set<String>> tree = service.getModuleHierarchy();
        assertEquals(Set.of("auth"), tree.get("root"));
        assertEquals(Set.of("auth.login", "auth.logout"), tree.get("auth"));

        assertEquals(new ChangeSummary(true, 1, 0, 1), service.changesSince(0));
        assertEquals(new ChangeSummary(false, 0, 0, 1), service.changesSince(1));
    }

    @Test
    void cursorReadsOnlyNewEntries() {
        LogQueryService service = serviceWith(100, 3);
        ReadCursor fromNow = service.openCursor(null);
        ReadCursor fromStart = service.openCursor(0L);

        assertFalse(service.hasUpdates(fromNow));
        assertEquals(List.of(1L, 2L), ids(service.readNew(fromStart, 10)));
    }

    @Test
    void queryRejectsBadArguments() {
        LogFilter none = LogFilter.none(RecordFields.DEFAULT);
        assertThrows(IllegalArgumentException.class, () -> new LogQuery(0L, 0, none));
        assertThrows(IllegalArgumentException.class, () -> new LogQuery(-1L, 10, none));
        assertThrows(NullPointerException.class, () -> new LogQuery(0L, 10, null));
    }
}

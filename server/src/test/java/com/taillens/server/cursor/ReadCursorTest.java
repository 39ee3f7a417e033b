/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.cursor;

import com.taillens.common.model.LogRecord;
import com.taillens.server.cache.EntryCache;
import com.taillens.server.cache.RecordFields;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Predicate;

import static com.taillens.server.TestRecords.*;
import static org.junit.jupiter.api.Assertions.*;

class ReadCursorTest {

    private static EntryCache cacheWith(int capacity, int count) {
        EntryCache cache = new EntryCache(capacity, RecordFields.DEFAULT);
        for (int i = 0; i < count; i++) cache.admit(record("m" + i));
        return cache;
    }

    @Test
    void openedCursorOnlySeesLaterRecords() {
        EntryCache cache = cacheWith(100, 5);
        ReadCursor cursor = ReadCursor.openAt(cache);

        assertTrue(cursor.read(cache, 10, null).isEmpty());
        assertEquals(ReadCursor.State.FRESH, cursor.state());
        assertEquals(4, cursor.lastDeliveredId());

        cache.admit(record("x"));
        cache.admit(record("y"));

        assertEquals(List.of(5L, 6L), ids(cursor.read(cache, 10, null)));
        assertEquals(ReadCursor.State.ADVANCED, cursor.state());
        assertEquals(6, cursor.lastDeliveredId());
        assertFalse(cursor.hasUpdates(cache));
    }

    @Test
    void readsInBatchesWithoutGapsOrRepeats() {
        EntryCache cache = cacheWith(100, 0);
        ReadCursor cursor = ReadCursor.openAt(cache);
        for (int i = 0; i < 5; i++) cache.admit(record("m" + i));

        assertEquals(List.of(0L, 1L), ids(cursor.read(cache, 2, null)));
        assertTrue(cursor.hasUpdates(cache));
        assertEquals(List.of(2L, 3L), ids(cursor.read(cache, 2, null)));
        assertEquals(List.of(4L), ids(cursor.read(cache, 2, null)));
        assertTrue(cursor.read(cache, 2, null).isEmpty());
    }

    @Test
    void resumeAfterKnownId() {
        EntryCache cache = cacheWith(100, 5);
        ReadCursor cursor = ReadCursor.resumeAfter(cache, 2);

        assertEquals(2, cursor.changes(cache).newCount());
        assertEquals(List.of(3L, 4L), ids(cursor.read(cache, 10, null)));
    }

    @Test
    void resumeBelowWindowStartsAtOldestResident() {
        EntryCache cache = cacheWith(3, 10);
        ReadCursor cursor = ReadCursor.resumeAfter(cache, 0);

        assertEquals(List.of(7L, 8L, 9L), ids(cursor.read(cache, 10, null)));
    }

    @Test
    void resumeBeyondNewestIdStartsFromNow() {
        EntryCache cache = cacheWith(100, 5);
        ReadCursor cursor = ReadCursor.resumeAfter(cache, 5000);

        assertEquals(4, cursor.lastDeliveredId());
        cache.admit(record("x"));
        cache.admit(record("y"));
        cache.admit(record("z"));

        assertTrue(cursor.hasUpdates(cache));
        assertEquals(List.of(5L, 6L, 7L), ids(cursor.read(cache, 10, null)));
    }

    @Test
    void resumeBeyondNewestIdOnEmptyCache() {
        EntryCache cache = cacheWith(100, 0);
        ReadCursor cursor = ReadCursor.resumeAfter(cache, 42);

        cache.admit(record("first"));

        assertEquals(List.of("first"), messages(cursor.read(cache, 10, null)));
    }

    @Test
    void generationChangeRebasesWithoutRedelivery() {
        EntryCache cache = cacheWith(100, 5);
        ReadCursor cursor = ReadCursor.openAt(cache);

        cache.resetWith(1, List.of(record("reloaded1"), record("reloaded2")));

        assertFalse(cursor.hasUpdates(cache));
        assertEquals(1, cursor.rebases());
        assertEquals(1, cursor.generation());
        assertEquals(6, cursor.lastDeliveredId());
        assertEquals(ReadCursor.State.FRESH, cursor.state());

        cache.admit(record("after"));
        assertEquals(List.of("after"), messages(cursor.read(cache, 10, null)));
        assertEquals(1, cursor.rebases());
    }

    @Test
    void filteredReadMovesPastRejectedRecords() {
        EntryCache cache = cacheWith(100, 0);
        ReadCursor cursor = ReadCursor.openAt(cache);
        cache.admit(record("a", "INFO", null, null));
        cache.admit(record("b", "ERROR", null, null));
        cache.admit(record("c", "INFO", null, null));
        Predicate<LogRecord> errors = r -> "ERROR".equals(r.text("levelname").orElse(""));

        assertEquals(List.of("b"), messages(cursor.read(cache, 10, errors)));
        assertEquals(2, cursor.lastDeliveredId());
        assertFalse(cursor.hasUpdates(cache));
    }

    @Test
    void zeroCountReadsNothingAndKeepsPosition() {
        EntryCache cache = cacheWith(100, 3);
        ReadCursor cursor = ReadCursor.resumeAfter(cache, 0);

        assertTrue(cursor.read(cache, 0, null).isEmpty());
        assertEquals(0, cursor.lastDeliveredId());
    }
}

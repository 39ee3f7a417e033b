/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import com.taillens.common.model.LogEntry;
import com.taillens.server.cache.EntryCache;
import com.taillens.server.cache.RecordFields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.taillens.server.TestRecords.*;
import static org.junit.jupiter.api.Assertions.*;

class LogStreamTest {

    private static final Duration HEARTBEAT = Duration.ofSeconds(15);

    private EntryCache cache;
    private LogQueryService service;
    private MutableClock clock;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        cache = new EntryCache(1_000, RecordFields.DEFAULT);
        service = new LogQueryService(cache);
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        listener = new RecordingListener();
    }

    private LogStream stream(Long lastKnownId, int batchSize) {
        return new LogStream(service, service.openCursor(lastKnownId), listener, batchSize, HEARTBEAT, clock);
    }

    @Test
    void tickDrainsNewEntriesInBatches() {
        LogStream stream = stream(null, 100);
        for (int i = 0; i < 250; i++) cache.admit(record("m" + i));

        assertEquals(250, stream.tick());

        assertEquals(List.of(100, 100, 50), listener.batchSizes());
        assertEquals(0L, listener.batches.get(0).get(0).id());
        assertEquals(249L, listener.lastId());
        assertEquals(250, stream.delivered());
        assertEquals(0, stream.tick());
    }

    @Test
    void streamStartsAfterLastKnownId() {
        for (int i = 0; i < 5; i++) cache.admit(record("m" + i));
        LogStream stream = stream(2L, 10);

        stream.tick();

        assertEquals(List.of(3L, 4L), ids(listener.batches.get(0)));
    }

    @Test
    void heartbeatAfterIdleInterval() {
        LogStream stream = stream(null, 10);

        clock.advance(Duration.ofSeconds(10));
        stream.tick();
        assertEquals(0, listener.heartbeats);

        clock.advance(Duration.ofSeconds(5));
        stream.tick();
        assertEquals(1, listener.heartbeats);

        stream.tick();
        assertEquals(1, listener.heartbeats);
    }

    @Test
    void deliveryPostponesHeartbeat() {
        LogStream stream = stream(null, 10);

        clock.advance(Duration.ofSeconds(14));
        cache.admit(record("x"));
        stream.tick();
        clock.advance(Duration.ofSeconds(14));
        stream.tick();

        assertEquals(0, listener.heartbeats);
        assertEquals(1, listener.batches.size());
    }

    @Test
    void listenerFailureCancelsStream() {
        listener.failing = true;
        LogStream stream = stream(null, 10);
        cache.admit(record("x"));

        assertEquals(0, stream.tick());
        assertTrue(stream.isCancelled());

        listener.failing = false;
        cache.admit(record("y"));
        assertEquals(0, stream.tick());
        assertTrue(listener.batches.isEmpty());
    }

    @Test
    void cancelledStreamDoesNothing() {
        LogStream stream = stream(null, 10);
        stream.cancel();
        cache.admit(record("x"));
        clock.advance(Duration.ofMinutes(1));

        assertEquals(0, stream.tick());
        assertTrue(listener.batches.isEmpty());
        assertEquals(0, listener.heartbeats);
    }

    @Test
    void rotationIsNotRedelivered() {
        LogStream stream = stream(null, 10);
        cache.admit(record("before"));
        stream.tick();

        cache.resetWith(1, List.of(record("reloaded")));
        assertEquals(0, stream.tick());
        cache.admit(record("after"));
        stream.tick();

        assertEquals(List.of("before"), messages(listener.batches.get(0)));
        assertEquals(List.of("after"), messages(listener.batches.get(1)));
        assertEquals(1, stream.cursor().rebases());
    }

    @Test
    void batchSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> stream(null, 0));
    }

    private static final class RecordingListener implements LogStreamListener {
        final List<List<LogEntry>> batches = new ArrayList<>();
        int heartbeats;
        boolean failing;

        @Override
        public void onEntries(List<LogEntry> entries) throws IOException {
            if (failing) throw new IOException("client went away");
            batches.add(entries);
        }

        @Override
        public void onHeartbeat() throws IOException {
            if (failing) throw new IOException("client went away");
            heartbeats++;
        }

        List<Integer> batchSizes() {
            List<Integer> sizes = new ArrayList<>();
            for (List<LogEntry> batch : batches) sizes.add(batch.size());
            return sizes;
        }

        long lastId() {
            List<LogEntry> last = batches.get(batches.size() - 1);
            return last.get(last.size() - 1).id();
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() { return ZoneOffset.UTC; }

        @Override
        public Clock withZone(ZoneId zone) { return this; }

        @Override
        public Instant instant() { return now; }
    }
}

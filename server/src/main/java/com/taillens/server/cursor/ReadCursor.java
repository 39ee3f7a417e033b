/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.cursor;

import com.taillens.common.model.ChangeSummary;
import com.taillens.common.model.LogEntry;
import com.taillens.common.model.LogRecord;
import com.taillens.server.cache.EntryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Predicate;

/**
 * A reader's bookmark into the record stream: the last id it was given, and the file
 * generation that id belongs to.
 *
 * <p>Before every read the cursor checks the cache's generation. If the file was
 * rotated, truncated or removed since, the cursor silently rebases onto the cache's
 * newest id and starts over as if freshly opened. Records from before the rotation are
 * not delivered, whether or not they were already read.</p>
 *
 * <p>A cursor belongs to one caller and is not thread-safe; the cache is only ever
 * touched under its lock.</p>
 */
public final class ReadCursor {

    private static final Logger log = LoggerFactory.getLogger(ReadCursor.class);

    public enum State { FRESH, ADVANCED }

    private long anchorId;
    private long offset;
    private long generation;
    private int rebases;

    private ReadCursor(long anchorId, long generation) {
        this.anchorId = anchorId;
        this.generation = generation;
    }

    /** Cursor positioned after the newest record: it will only see later records. */
    public static ReadCursor openAt(EntryCache cache) {
        return cache.atomically(() -> new ReadCursor(cache.lastAssignedId(), cache.generation()));
    }

    /**
     * Cursor resuming after {@code lastKnownId} in the current generation. Records below
     * the resident window are gone; reading starts at the oldest resident one. An id
     * above the newest assigned one (a client that saw a previous process) is clamped
     * to it, so the cursor behaves like {@link #openAt(EntryCache)}.
     */
    public static ReadCursor resumeAfter(EntryCache cache, long lastKnownId) {
        return cache.atomically(() -> {
            long newest = cache.lastAssignedId();
            if (lastKnownId > newest) {
                log.debug("Resume id {} is beyond the newest id {}, starting from now", lastKnownId, newest);
                return new ReadCursor(newest, cache.generation());
            }
            return new ReadCursor(lastKnownId, cache.generation());
        });
    }

    /**
     * Deliver up to {@code maxCount} records newer than this cursor and move past them.
     *
     * @param filter record predicate, {@code null} for all; records it rejects are
     *               skipped for good
     */
    public List<LogEntry> read(EntryCache cache, int maxCount, Predicate<LogRecord> filter) {
        return cache.atomically(() -> {
            recover(cache);
            if (maxCount <= 0) return List.<LogEntry>of();
            long position = lastDeliveredId();
            List<LogEntry> batch = cache.get(position + 1, maxCount, filter);
            if (batch.size() == maxCount) {
                advanceTo(batch.get(batch.size() - 1).id());
            } else {
                // the whole window past the cursor was scanned
                long maxId = cache.maxId();
                if (maxId > position) advanceTo(maxId);
            }
            return batch;
        });
    }

    /** Whether records newer than this cursor are resident, after rotation recovery. */
    public ChangeSummary changes(EntryCache cache) {
        return cache.atomically(() -> {
            recover(cache);
            return cache.changesSince(lastDeliveredId());
        });
    }

    public boolean hasUpdates(EntryCache cache) {
        return changes(cache).hasUpdates();
    }

    /** Id of the last record this cursor has moved past. */
    public long lastDeliveredId() {
        return anchorId + offset;
    }

    public long anchorId() { return anchorId; }

    /** Records moved past since the anchor. */
    public long offset() { return offset; }

    public long generation() { return generation; }

    /** Times this cursor was rebased because the file generation changed. */
    public int rebases() { return rebases; }

    public State state() {
        return offset == 0 ? State.FRESH : State.ADVANCED;
    }

    private void recover(EntryCache cache) {
        long current = cache.generation();
        if (current == generation) return;
        long newest = cache.lastAssignedId();
        log.debug("Cursor at {} (generation {}) rebased to {} (generation {})",
                lastDeliveredId(), generation, newest, current);
        anchorId = newest;
        offset = 0;
        generation = current;
        rebases++;
    }

    private void advanceTo(long id) {
        offset = id - anchorId;
    }

    @Override
    public String toString() {
        return "ReadCursor{lastDeliveredId=" + lastDeliveredId() + ", generation=" + generation
                + ", state=" + state() + "}";
    }
}

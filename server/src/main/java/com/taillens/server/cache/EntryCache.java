/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.cache;

import com.taillens.common.model.ChangeSummary;
import com.taillens.common.model.LogEntry;
import com.taillens.common.model.LogRecord;
import com.taillens.common.util.RingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Sliding window of the most recent log records, each under a process-unique id.
 *
 * <h3>Ids</h3>
 * Ids start at {@code 0} and grow by exactly one per admitted record. They are never
 * reused: eviction and {@link #reset(long)} leave the counter untouched, so an id means
 * the same record for the whole life of the process. Because resident ids are
 * contiguous, the position of any id inside the buffer is {@code id - minId}.
 *
 * <h3>Thread Safety</h3>
 * One {@link ReentrantLock} guards every mutation and every read that looks at more
 * than one field. The tailer thread is the only writer; any number of reader threads
 * may query concurrently. {@link #atomically(Supplier)} lets a caller compose several
 * reads into one consistent view.
 */
public class EntryCache {

    private static final Logger log = LoggerFactory.getLogger(EntryCache.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final RingBuffer<LogEntry> buffer;
    private final ModuleHierarchy hierarchy = new ModuleHierarchy();
    private final RecordFields fields;

    private long nextId = 0;
    private long generation = 0;

    /**
     * @param capacity maximum resident records; {@code 0} keeps everything
     * @param fields   record fields used to derive category paths
     */
    public EntryCache(int capacity, RecordFields fields) {
        this.buffer = new RingBuffer<>(capacity);
        this.fields = fields;
    }

    // ─── Mutation ───────────────────────────────────────────────────

    /** Assign the next id to a record and append it, evicting the oldest at capacity. */
    public LogEntry admit(LogRecord record) {
        lock.lock();
        try {
            return append(record);
        } finally {
            lock.unlock();
        }
    }

    /** Admit a batch under a single lock acquisition. */
    public List<LogEntry> admitAll(List<? extends LogRecord> records) {
        if (records.isEmpty()) return List.of();
        lock.lock();
        try {
            return appendAll(records);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every resident record and the category tree, and publish a new file
     * generation. The id counter keeps counting.
     */
    public void reset(long newGeneration) {
        resetWith(newGeneration, List.of());
    }

    /**
     * Reset and admit the reloaded content in one step, so no reader can observe the
     * new generation without its content.
     */
    public List<LogEntry> resetWith(long newGeneration, List<? extends LogRecord> records) {
        lock.lock();
        try {
            int dropped = buffer.size();
            buffer.clear();
            hierarchy.clear();
            generation = newGeneration;
            log.debug("Cache reset to generation {}, dropped {} entries, next id {}",
                    newGeneration, dropped, nextId);
            return appendAll(records);
        } finally {
            lock.unlock();
        }
    }

    // ─── Queries ────────────────────────────────────────────────────

    /**
     * Up to {@code maxCount} entries with {@code id >= startId} that match the filter,
     * in ascending id order. A {@code startId} below the window starts at the oldest
     * resident entry; one above the window yields an empty list.
     *
     * @param filter record predicate, {@code null} matches everything
     */
    public List<LogEntry> get(long startId, int maxCount, Predicate<LogRecord> filter) {
        lock.lock();
        try {
            if (maxCount <= 0 || buffer.isEmpty()) return List.of();
            long minId = buffer.first().id();
            long maxId = buffer.last().id();
            if (startId > maxId) return List.of();

            int index = (int) (Math.max(startId, minId) - minId);
            List<LogEntry> result = new ArrayList<>(Math.min(maxCount, buffer.size() - index));
            for (int i = index; i < buffer.size() && result.size() < maxCount; i++) {
                LogEntry entry = buffer.get(i);
                if (filter == null || filter.test(entry.record())) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** The newest {@code maxCount} matching entries, in ascending id order. */
    public List<LogEntry> tail(int maxCount, Predicate<LogRecord> filter) {
        lock.lock();
        try {
            if (maxCount <= 0 || buffer.isEmpty()) return List.of();
            List<LogEntry> result = new ArrayList<>(Math.min(maxCount, buffer.size()));
            for (int i = buffer.size() - 1; i >= 0 && result.size() < maxCount; i--) {
                LogEntry entry = buffer.get(i);
                if (filter == null || filter.test(entry.record())) {
                    result.add(entry);
                }
            }
            Collections.reverse(result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Resident entries matching the filter ({@code null} counts everything). */
    public long count(Predicate<LogRecord> filter) {
        lock.lock();
        try {
            if (filter == null) return buffer.size();
            long n = 0;
            for (LogEntry entry : buffer) {
                if (filter.test(entry.record())) n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether resident entries newer than {@code lastKnownId} exist, how many, and the
     * resident id range. Entries already evicted are not counted.
     */
    public ChangeSummary changesSince(long lastKnownId) {
        lock.lock();
        try {
            if (buffer.isEmpty()) return ChangeSummary.empty();
            long minId = buffer.first().id();
            long maxId = buffer.last().id();
            long newCount = Math.max(0, maxId - Math.max(minId - 1, lastKnownId));
            return new ChangeSummary(newCount > 0, newCount, minId, maxId);
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the category tree. */
    public Map<String, Set<String>> hierarchySnapshot() {
        lock.lock();
        try {
            return hierarchy.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@code action} while holding the cache lock. Every cache method called from
     * inside sees the same state.
     */
    public <T> T atomically(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Id given to the most recently admitted record, {@code -1} before the first. */
    public long lastAssignedId() {
        lock.lock();
        try {
            return nextId - 1;
        } finally {
            lock.unlock();
        }
    }

    /** Oldest resident id, {@code -1} when empty. */
    public long minId() {
        lock.lock();
        try {
            return buffer.isEmpty() ? -1 : buffer.first().id();
        } finally {
            lock.unlock();
        }
    }

    /** Newest resident id, {@code -1} when empty. */
    public long maxId() {
        lock.lock();
        try {
            return buffer.isEmpty() ? -1 : buffer.last().id();
        } finally {
            lock.unlock();
        }
    }

    /** File generation published by the last {@link #reset(long)}. */
    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /** Configured capacity, {@code 0} when unbounded. */
    public int capacity() {
        return buffer.capacity();
    }

    public RecordFields fields() {
        return fields;
    }

    // ─── Internal (lock held) ───────────────────────────────────────

    private List<LogEntry> appendAll(List<? extends LogRecord> records) {
        List<LogEntry> admitted = new ArrayList<>(records.size());
        for (LogRecord record : records) {
            admitted.add(append(record));
        }
        return admitted;
    }

    private LogEntry append(LogRecord record) {
        LogEntry entry = new LogEntry(nextId++, record);
        buffer.add(entry);
        fields.categoryOf(record).ifPresent(hierarchy::record);
        return entry;
    }

    @Override
    public String toString() {
        return "EntryCache{size=" + size() + ", capacity=" + capacity()
                + ", nextId=" + (lastAssignedId() + 1) + ", generation=" + generation() + "}";
    }
}

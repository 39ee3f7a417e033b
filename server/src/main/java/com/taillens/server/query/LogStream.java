/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import com.taillens.common.model.LogEntry;
import com.taillens.server.cursor.ReadCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Incremental push delivery over one {@link ReadCursor}.
 *
 * <p>The transport calls {@link #tick()} at a fixed cadence (every 500 ms by default).
 * Each tick checks for records past the cursor and hands them to the listener in
 * batches until the cursor has caught up. When a heartbeat interval passes without
 * delivery, the listener gets a heartbeat so the transport can notice dead
 * connections. The stream only reads the cache.</p>
 *
 * <p>The stream ends when {@link #cancel()} is called or the listener throws
 * {@link IOException}; later ticks are no-ops. A cancelled stream cannot be restarted.</p>
 */
public class LogStream {

    private static final Logger log = LoggerFactory.getLogger(LogStream.class);

    private final LogQueryService queries;
    private final ReadCursor cursor;
    private final LogStreamListener listener;
    private final int batchSize;
    private final Duration heartbeatInterval;
    private final Clock clock;

    private volatile boolean cancelled = false;
    private Instant lastActivity;
    private long delivered;

    LogStream(LogQueryService queries, ReadCursor cursor, LogStreamListener listener,
              int batchSize, Duration heartbeatInterval, Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        this.queries = queries;
        this.cursor = cursor;
        this.listener = listener;
        this.batchSize = batchSize;
        this.heartbeatInterval = heartbeatInterval;
        this.clock = clock;
        this.lastActivity = clock.instant();
    }

    /**
     * One cadence step.
     *
     * @return number of entries delivered during this tick
     */
    public synchronized int tick() {
        if (cancelled) return 0;
        int sent = 0;
        try {
            while (!cancelled && queries.hasUpdates(cursor)) {
                List<LogEntry> batch = queries.readNew(cursor, batchSize);
                if (batch.isEmpty()) break;
                listener.onEntries(batch);
                sent += batch.size();
                if (batch.size() < batchSize) break;
            }
            Instant now = clock.instant();
            if (sent > 0) {
                delivered += sent;
                lastActivity = now;
            } else if (!cancelled && Duration.between(lastActivity, now).compareTo(heartbeatInterval) >= 0) {
                listener.onHeartbeat();
                lastActivity = now;
            }
        } catch (IOException e) {
            log.debug("Stream listener failed at id {}, closing stream: {}", cursor.lastDeliveredId(), e.getMessage());
            cancel();
        }
        return sent;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() { return cancelled; }

    /** Total entries handed to the listener. */
    public synchronized long delivered() { return delivered; }

    public ReadCursor cursor() { return cursor; }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.stream;

import com.taillens.server.query.LogStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks open log streams and drives each one on a fixed cadence from a small
 * shared scheduler. A stream whose listener failed is unregistered on its next tick.
 */
public class StreamSessionManager {

    private static final Logger log = LoggerFactory.getLogger(StreamSessionManager.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, Session> activeSessions = new ConcurrentHashMap<>();

    public StreamSessionManager(int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "log-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Session metadata exposed for diagnostics. */
    public record Session(String sessionId, Instant openedAt, LogStream stream, ScheduledFuture<?> future) {}

    /**
     * Start ticking {@code stream} every {@code interval}.
     *
     * @return the session id to pass to {@link #unregister(String)}
     */
    public String register(LogStream stream, Duration interval) {
        String sessionId = UUID.randomUUID().toString();
        long periodMs = interval.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
                () -> tick(sessionId, stream), periodMs, periodMs, TimeUnit.MILLISECONDS);
        activeSessions.put(sessionId, new Session(sessionId, Instant.now(), stream, future));
        log.info("Registered log stream {} (from id {}), {} active",
                sessionId, stream.cursor().lastDeliveredId(), activeSessions.size());
        return sessionId;
    }

    public void unregister(String sessionId) {
        Session removed = activeSessions.remove(sessionId);
        if (removed != null) {
            removed.stream().cancel();
            removed.future().cancel(false);
            log.info("Unregistered log stream {} after {} entries, {} active",
                    sessionId, removed.stream().delivered(), activeSessions.size());
        }
    }

    public Optional<Session> getSession(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    public Collection<Session> getActiveSessions() {
        return Collections.unmodifiableCollection(activeSessions.values());
    }

    public int getActiveCount() {
        return activeSessions.size();
    }

    /** Cancel every open stream and stop the scheduler. */
    public int shutdown() {
        List<String> ids = new ArrayList<>(activeSessions.keySet());
        ids.forEach(this::unregister);
        scheduler.shutdownNow();
        return ids.size();
    }

    private void tick(String sessionId, LogStream stream) {
        try {
            stream.tick();
        } catch (RuntimeException e) {
            // an escaping exception would silently end the periodic task
            log.warn("Log stream {} failed: {}", sessionId, e.getMessage());
            stream.cancel();
        }
        if (stream.isCancelled()) {
            unregister(sessionId);
        }
    }
}

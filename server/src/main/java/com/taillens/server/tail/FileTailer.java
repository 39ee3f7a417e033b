/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.tail;

import com.taillens.common.model.LogRecord;
import com.taillens.common.model.RawRecord;
import com.taillens.server.cache.EntryCache;
import com.taillens.server.decode.LineDecoder;
import com.taillens.server.metrics.TailMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Follows one log file and feeds its lines into an {@link EntryCache}.
 *
 * <h3>Poll cycle</h3>
 * <ol>
 *   <li>File missing: if a file was known, reset the cache under a new generation.
 *       Retry after the missing-file interval.</li>
 *   <li>File identity changed (rotation, or the file re-appeared): new generation,
 *       reset, reload the current content.</li>
 *   <li>File shorter than the consumed offset (truncation): same as rotation.</li>
 *   <li>File longer: read the appended complete lines and admit them as one batch.</li>
 *   <li>Otherwise idle: the next poll is delayed by {@link PollBackoff}.</li>
 * </ol>
 *
 * <p>A single daemon thread runs the cycle, re-scheduling itself with the delay each
 * outcome calls for. Errors inside a cycle are logged and followed by a cooldown; they
 * never stop the tailer. {@link #pollOnce()} and {@link #loadInitial()} are public so
 * the state machine can be driven synchronously.</p>
 */
public class FileTailer {

    private static final Logger log = LoggerFactory.getLogger(FileTailer.class);

    private static final int MAX_READ_ATTEMPTS = 3;

    private final TailerSettings settings;
    private final LineDecoder decoder;
    private final EntryCache cache;
    private final TailMetrics metrics;
    private final FileState state;
    private final PollBackoff backoff;
    private final IdentityReader identities;

    private volatile boolean running = false;
    private ScheduledExecutorService scheduler;

    public FileTailer(TailerSettings settings, LineDecoder decoder, EntryCache cache, TailMetrics metrics) {
        this(settings, decoder, cache, metrics, FileFingerprint::of);
    }

    FileTailer(TailerSettings settings, LineDecoder decoder, EntryCache cache, TailMetrics metrics,
               IdentityReader identities) {
        this.settings = settings;
        this.decoder = decoder;
        this.cache = cache;
        this.metrics = metrics;
        this.state = new FileState(settings.path());
        this.backoff = new PollBackoff(settings.minPollInterval(), settings.maxPollInterval(),
                settings.backoffMultiplier());
        this.identities = identities;
    }

    // ─── Lifecycle ──────────────────────────────────────────────────

    /**
     * Load the current file content and start the background poll loop.
     * Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (running) return;
        running = true;
        log.info("FileTailer: starting on {} ({})", settings.path().toAbsolutePath(), settings);
        loadInitial();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "log-tailer");
            t.setDaemon(true);
            return t;
        });
        scheduleNext(settings.minPollInterval());
        log.info("FileTailer: running, {} entries resident, offset {}", cache.size(), state.offset());
    }

    /**
     * Stop the poll loop, waiting up to the configured shutdown timeout for an
     * in-flight cycle to finish.
     */
    public void stop() {
        ScheduledExecutorService exec;
        synchronized (this) {
            if (!running) return;
            running = false;
            exec = scheduler;
        }
        if (exec == null) return;
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("FileTailer: poll thread did not terminate within {}ms", settings.shutdownTimeout().toMillis());
            } else {
                log.info("FileTailer: stopped, generation {}, offset {}", state.generation(), state.offset());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("FileTailer: interrupted while waiting for the poll thread to stop");
        }
    }

    public boolean isRunning() { return running; }

    public FileState state() { return state; }

    public PollBackoff backoff() { return backoff; }

    // ─── Poll state machine ─────────────────────────────────────────

    /**
     * Read the file's current content into the cache, as done at startup.
     *
     * <p>Once a file has been loaded, later calls change nothing and return
     * {@link PollOutcome#IDLE}; the poll cycle takes over from there.</p>
     *
     * @return {@link PollOutcome#GREW} on success, {@link PollOutcome#MISSING} if there
     *         is no file yet, {@link PollOutcome#ERROR} if it could not be read
     */
    public synchronized PollOutcome loadInitial() {
        Path path = settings.path();
        if (state.fingerprint() != null) {
            log.debug("FileTailer: {} already loaded, ignoring repeated initial load", path);
            return PollOutcome.IDLE;
        }
        if (!Files.exists(path)) {
            log.info("FileTailer: {} does not exist yet, waiting for it", path);
            return PollOutcome.MISSING;
        }
        try {
            Snapshot snapshot = readWhole(path);
            int admitted = cache.admitAll(snapshot.records()).size();
            state.attach(snapshot.fingerprint(), snapshot.endOffset());
            log.info("FileTailer: loaded {} lines from {}", admitted, path);
            return PollOutcome.GREW;
        } catch (IOException | RuntimeException e) {
            metrics.recordPollError();
            log.warn("FileTailer: initial load of {} failed: {}", path, e.getMessage());
            return PollOutcome.ERROR;
        }
    }

    /** Run one poll step. Never throws. */
    public synchronized PollOutcome pollOnce() {
        Path path = settings.path();
        try {
            if (!Files.exists(path)) {
                handleMissing(path);
                return PollOutcome.MISSING;
            }
            FileFingerprint current = identities.read(path);
            if (!current.equals(state.fingerprint())) {
                resetAndReload(path, state.fingerprint() == null ? "appearance" : "rotation");
                return PollOutcome.ROTATED;
            }
            long size = Files.size(path);
            if (size < state.offset()) {
                resetAndReload(path, "truncation");
                return PollOutcome.TRUNCATED;
            }
            if (size > state.offset()) {
                return readAppended(path, size) > 0 ? PollOutcome.GREW : PollOutcome.IDLE;
            }
            return PollOutcome.IDLE;
        } catch (IOException | RuntimeException e) {
            metrics.recordPollError();
            log.warn("FileTailer: poll of {} failed, retrying in {}ms: {}",
                    path, settings.errorCooldown().toMillis(), e.getMessage());
            return PollOutcome.ERROR;
        }
    }

    /** Delay before the next poll after a step ended with {@code outcome}. */
    Duration nextDelay(PollOutcome outcome) {
        return switch (outcome) {
            case GREW, ROTATED, TRUNCATED -> backoff.onActivity();
            case IDLE -> backoff.onIdle();
            case MISSING -> settings.missingFileInterval();
            case ERROR -> settings.errorCooldown();
        };
    }

    // ─── Internal ───────────────────────────────────────────────────

    private void runCycle() {
        if (!running) return;
        PollOutcome outcome = pollOnce();
        Duration delay = nextDelay(outcome);
        if (outcome != PollOutcome.IDLE) {
            log.debug("FileTailer: {}, next poll in {}ms", outcome, delay.toMillis());
        }
        scheduleNext(delay);
    }

    private void scheduleNext(Duration delay) {
        if (!running) return;
        try {
            scheduler.schedule(this::runCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("FileTailer: scheduler shut down, not scheduling another poll");
        }
    }

    private void handleMissing(Path path) {
        if (state.fingerprint() == null) return;
        long generation = state.nextGeneration();
        state.forget();
        cache.reset(generation);
        metrics.recordReset("missing");
        log.warn("FileTailer: {} disappeared, cache cleared, generation {}", path, generation);
    }

    private void resetAndReload(Path path, String reason) throws IOException {
        Snapshot snapshot = readWhole(path);
        long generation = state.nextGeneration();
        int admitted = cache.resetWith(generation, snapshot.records()).size();
        state.attach(snapshot.fingerprint(), snapshot.endOffset());
        metrics.recordReset(reason);
        log.info("FileTailer: {} of {} detected, generation {}, reloaded {} lines",
                reason, path, generation, admitted);
    }

    private int readAppended(Path path, long size) throws IOException {
        LineChunkReader.Chunk chunk;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            chunk = LineChunkReader.read(channel, state.offset(), size, 0);
        }
        if (chunk.lines().isEmpty()) {
            return 0;
        }
        int admitted = cache.admitAll(decodeAll(chunk.lines())).size();
        state.advanceTo(chunk.endOffset());
        log.debug("FileTailer: admitted {} lines, offset now {}", admitted, chunk.endOffset());
        return admitted;
    }

    /**
     * Read the whole file. The identity is taken before and after the read; if the file
     * was replaced in between, the content may belong to either file, so read again.
     */
    private Snapshot readWhole(Path path) throws IOException {
        for (int attempt = 1; ; attempt++) {
            FileFingerprint before = identities.read(path);
            LineChunkReader.Chunk chunk;
            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
                chunk = LineChunkReader.read(channel, 0, channel.size(), settings.capacity());
            }
            FileFingerprint after = identities.read(path);
            if (before.equals(after)) {
                return new Snapshot(after, decodeAll(chunk.lines()), chunk.endOffset());
            }
            if (attempt >= MAX_READ_ATTEMPTS) {
                throw new IOException("File " + path + " kept changing identity during "
                        + MAX_READ_ATTEMPTS + " reads");
            }
            log.debug("FileTailer: {} was replaced while reading, reading again", path);
        }
    }

    private List<LogRecord> decodeAll(List<String> lines) {
        List<LogRecord> records = new ArrayList<>(lines.size());
        int raw = 0;
        for (String line : lines) {
            LogRecord record = decoder.decode(line);
            if (record instanceof RawRecord) raw++;
            records.add(record);
        }
        metrics.recordAdmitted(records.size(), raw);
        return records;
    }

    /** Source of file identities; {@link FileFingerprint#of(Path)} outside tests. */
    @FunctionalInterface
    interface IdentityReader {
        FileFingerprint read(Path path) throws IOException;
    }

    private record Snapshot(FileFingerprint fingerprint, List<LogRecord> records, long endOffset) {}
}

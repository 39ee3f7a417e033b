/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.metrics;

import com.taillens.server.cache.EntryCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer instrumentation for the tailing engine.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>taillens.lines.admitted</td><td>Counter</td><td>none</td></tr>
 *   <tr><td>taillens.lines.raw</td><td>Counter</td><td>none</td></tr>
 *   <tr><td>taillens.file.resets</td><td>Counter</td><td>reason</td></tr>
 *   <tr><td>taillens.poll.errors</td><td>Counter</td><td>none</td></tr>
 *   <tr><td>taillens.cache.size</td><td>Gauge</td><td>none</td></tr>
 *   <tr><td>taillens.cache.generation</td><td>Gauge</td><td>none</td></tr>
 * </table>
 */
public class TailMetrics {

    private final MeterRegistry registry;
    private final Counter linesAdmitted;
    private final Counter rawLines;
    private final Counter pollErrors;
    private final Map<String, Counter> resetCounters = new ConcurrentHashMap<>();

    public TailMetrics(MeterRegistry registry, EntryCache cache) {
        this.registry = registry;

        this.linesAdmitted = Counter.builder("taillens.lines.admitted")
                .description("Log lines decoded and admitted to the cache")
                .register(registry);
        this.rawLines = Counter.builder("taillens.lines.raw")
                .description("Admitted lines that were not JSON objects")
                .register(registry);
        this.pollErrors = Counter.builder("taillens.poll.errors")
                .description("Poll cycles that failed with an I/O or runtime error")
                .register(registry);

        Gauge.builder("taillens.cache.size", cache, EntryCache::size)
                .description("Records currently resident in the cache")
                .register(registry);
        Gauge.builder("taillens.cache.generation", cache, EntryCache::generation)
                .description("File generation (rotations, truncations and disappearances handled)")
                .register(registry);
    }

    public void recordAdmitted(int total, int raw) {
        linesAdmitted.increment(total);
        if (raw > 0) rawLines.increment(raw);
    }

    /** @param reason {@code rotation}, {@code appearance}, {@code truncation} or {@code missing} */
    public void recordReset(String reason) {
        resetCounters.computeIfAbsent(reason, r -> Counter.builder("taillens.file.resets")
                .description("Cache resets caused by changes to the watched file")
                .tag("reason", r)
                .register(registry)).increment();
    }

    public void recordPollError() {
        pollErrors.increment();
    }
}

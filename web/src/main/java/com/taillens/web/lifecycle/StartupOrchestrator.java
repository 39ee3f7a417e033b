/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.lifecycle;

import com.taillens.server.cache.EntryCache;
import com.taillens.server.tail.FileTailer;
import com.taillens.server.tail.TailerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the file tailer once the Spring context is ready and announces the
 * endpoints.
 *
 * <pre>
 * Phase 1: Initial load of the watched file
 * Phase 2: Background poll loop
 * FINAL:   Ready announcement with URLs
 * </pre>
 */
@Component
public class StartupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StartupOrchestrator.class);

    private final FileTailer fileTailer;
    private final EntryCache entryCache;
    private final TailerSettings settings;

    @Value("${taillens.app-name:TailLens}")
    private String appName;

    @Value("${taillens.version:1.0.0}")
    private String version;

    @Value("${server.port:8080}")
    private int serverPort;

    private final AtomicBoolean startupComplete = new AtomicBoolean(false);

    public StartupOrchestrator(FileTailer fileTailer, EntryCache entryCache, TailerSettings settings) {
        this.fileTailer = fileTailer;
        this.entryCache = entryCache;
        this.settings = settings;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!startupComplete.compareAndSet(false, true)) return;
        Instant startTime = Instant.now();

        logBanner("STARTUP INITIATED",
                appName + " v" + version,
                "Timestamp: " + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));

        logPhase(1, "Load Watched File", settings.path().toAbsolutePath().toString());
        logPhase(2, "Start Poll Loop",
                "Polling every " + settings.minPollInterval().toMillis() + ".."
                        + settings.maxPollInterval().toMillis() + " ms");
        try {
            fileTailer.start();
        } catch (RuntimeException e) {
            log.error("File tailer failed to start: {}", e.getMessage(), e);
            return;
        }
        log.info("✓ Phase 1 complete: {} entries resident (capacity {})",
                entryCache.size(), settings.capacity() == 0 ? "unbounded" : settings.capacity());
        log.info("✓ Phase 2 complete: tailer running, generation {}", entryCache.generation());

        Duration elapsed = Duration.between(startTime, Instant.now());
        String base = "http://localhost:" + serverPort + "/api/v1/logs";
        logBanner("SYSTEM READY",
                "Logs    : " + base,
                "Stream  : " + base + "/stream",
                "Modules : " + base + "/modules",
                "Stats   : " + base + "/stats",
                "Startup : " + elapsed.toMillis() + " ms");
    }

    public boolean isStartupComplete() {
        return startupComplete.get();
    }

    // ─── Logging Helpers ──────────────────────────────────────────────────────

    private void logBanner(String title, String... lines) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  {}{}║", title, pad(title, 65));
        for (String line : lines) {
            log.info("║  {}{}║", line, pad(line, 65));
        }
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("");
    }

    private void logPhase(int number, String title, String description) {
        log.info("Phase {}: {} ({})", number, title, description);
    }

    private String pad(String text, int totalWidth) {
        int remaining = totalWidth - text.length();
        if (remaining <= 0) return " ";
        return " ".repeat(remaining);
    }
}

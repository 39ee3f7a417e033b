/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.lifecycle;

import com.taillens.server.tail.FileTailer;
import com.taillens.web.stream.StreamSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Tears down in reverse order of startup.
 *
 * <pre>
 * Phase 1: Cancel open log streams
 * Phase 2: Stop the file tailer (bounded wait)
 * </pre>
 */
@Component
public class ShutdownOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);

    private final FileTailer fileTailer;
    private final StreamSessionManager streamSessionManager;

    public ShutdownOrchestrator(FileTailer fileTailer, StreamSessionManager streamSessionManager) {
        this.fileTailer = fileTailer;
        this.streamSessionManager = streamSessionManager;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        Instant shutdownStart = Instant.now();
        log.info("Shutdown initiated");

        try {
            int cancelled = streamSessionManager.shutdown();
            log.info("✓ Phase 1 complete: {} log stream(s) cancelled", cancelled);
        } catch (Exception e) {
            log.warn("  ⚠ Stream shutdown issue: {}", e.getMessage());
        }

        try {
            fileTailer.stop();
            log.info("✓ Phase 2 complete: file tailer stopped at offset {}", fileTailer.state().offset());
        } catch (Exception e) {
            log.warn("  ⚠ Tailer shutdown issue: {}", e.getMessage());
        }

        log.info("Shutdown complete in {} ms", Duration.between(shutdownStart, Instant.now()).toMillis());
    }
}

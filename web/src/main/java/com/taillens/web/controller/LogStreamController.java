/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.controller;

import com.taillens.server.query.LogQueryService;
import com.taillens.server.query.LogStream;
import com.taillens.server.query.QueryParams;
import com.taillens.web.stream.SseLogStreamListener;
import com.taillens.web.stream.StreamSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;

/**
 * Live log stream over Server-Sent Events.
 * Each connection gets its own cursor; batches of new entries arrive as {@code log}
 * events and an idle connection receives a {@code heartbeat} comment.
 */
@Controller
public class LogStreamController {

    private static final Logger log = LoggerFactory.getLogger(LogStreamController.class);

    private final LogQueryService queryService;
    private final StreamSessionManager sessionManager;

    @Value("${taillens.stream.interval:500ms}")
    private Duration interval;

    @Value("${taillens.stream.heartbeat:15s}")
    private Duration heartbeat;

    @Value("${taillens.stream.batch-size:100}")
    private int batchSize;

    @Value("${taillens.stream.timeout:5m}")
    private Duration timeout;

    public LogStreamController(LogQueryService queryService, StreamSessionManager sessionManager) {
        this.queryService = queryService;
        this.sessionManager = sessionManager;
    }

    /**
     * GET /api/v1/logs/stream - SSE stream of entries newer than {@code last_log_id},
     * or of entries admitted from now on when it is absent.
     *
     * <p>A reconnecting EventSource sends the id of the last event it received as
     * {@code Last-Event-ID}; when present it takes precedence over {@code last_log_id}.</p>
     */
    @GetMapping(value = "/api/v1/logs/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @ResponseBody
    public SseEmitter streamLogs(@RequestParam(name = "last_log_id", required = false) String lastLogId,
                                 @RequestHeader(name = "Last-Event-ID", required = false) String lastEventId) {
        Long lastKnownId = lastEventId != null && !lastEventId.isBlank()
                ? QueryParams.parseId("Last-Event-ID", lastEventId)
                : QueryParams.parseId("last_log_id", lastLogId);
        SseEmitter emitter = new SseEmitter(timeout.toMillis());

        LogStream stream = queryService.openStream(lastKnownId, new SseLogStreamListener(emitter),
                batchSize, heartbeat);
        String sessionId = sessionManager.register(stream, interval);

        emitter.onCompletion(() -> sessionManager.unregister(sessionId));
        emitter.onTimeout(() -> {
            log.debug("Log stream {} timed out after {}ms", sessionId, timeout.toMillis());
            sessionManager.unregister(sessionId);
            emitter.complete();
        });
        emitter.onError(t -> sessionManager.unregister(sessionId));
        return emitter;
    }
}

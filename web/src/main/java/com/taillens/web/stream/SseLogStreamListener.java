/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.stream;

import com.taillens.common.model.LogEntry;
import com.taillens.common.util.JsonUtil;
import com.taillens.server.query.LogStreamListener;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;

/**
 * Writes stream batches to an {@link SseEmitter}: one {@code log} event per batch
 * carrying a JSON array, and a {@code heartbeat} comment when idle.
 */
public class SseLogStreamListener implements LogStreamListener {

    public static final String LOG_EVENT = "log";

    private final SseEmitter emitter;

    public SseLogStreamListener(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void onEntries(List<LogEntry> entries) throws IOException {
        send(SseEmitter.event()
                .name(LOG_EVENT)
                .id(String.valueOf(entries.get(entries.size() - 1).id()))
                .data(JsonUtil.toJson(entries), MediaType.APPLICATION_JSON));
    }

    @Override
    public void onHeartbeat() throws IOException {
        send(SseEmitter.event().comment("heartbeat"));
    }

    private void send(SseEmitter.SseEventBuilder event) throws IOException {
        try {
            emitter.send(event);
        } catch (IllegalStateException e) {
            // emitter already completed or timed out
            throw new IOException("SSE emitter is closed", e);
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.config;

import com.taillens.server.cache.EntryCache;
import com.taillens.server.cache.RecordFields;
import com.taillens.server.decode.JsonLineDecoder;
import com.taillens.server.decode.LineDecoder;
import com.taillens.server.metrics.TailMetrics;
import com.taillens.server.query.LogQueryService;
import com.taillens.server.tail.FileTailer;
import com.taillens.server.tail.TailerSettings;
import com.taillens.web.stream.StreamSessionManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the plain-Java engine from {@code taillens.*} properties.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Value("${taillens.file.path:logs/application.log}")
    private String filePath;

    @Value("${taillens.cache.capacity:10000}")
    private int capacity;

    // --- Polling ---
    @Value("${taillens.poll.min-interval:100ms}")
    private Duration minPollInterval;

    @Value("${taillens.poll.max-interval:10s}")
    private Duration maxPollInterval;

    @Value("${taillens.poll.backoff-multiplier:1.5}")
    private double backoffMultiplier;

    @Value("${taillens.poll.missing-file-interval:5s}")
    private Duration missingFileInterval;

    @Value("${taillens.poll.error-cooldown:5s}")
    private Duration errorCooldown;

    @Value("${taillens.shutdown-timeout:5s}")
    private Duration shutdownTimeout;

    // --- Record fields ---
    @Value("${taillens.fields.level:levelname}")
    private String levelField;

    @Value("${taillens.fields.module:module}")
    private String moduleField;

    @Value("${taillens.fields.name:name}")
    private String nameField;

    @Value("${taillens.stream.pool-size:2}")
    private int streamPoolSize;

    @Bean
    public RecordFields recordFields() {
        return new RecordFields(levelField, moduleField, nameField);
    }

    @Bean
    public EntryCache entryCache(RecordFields fields) {
        return new EntryCache(capacity, fields);
    }

    @Bean
    public LineDecoder lineDecoder() {
        return new JsonLineDecoder();
    }

    @Bean
    public TailMetrics tailMetrics(MeterRegistry meterRegistry, EntryCache cache) {
        return new TailMetrics(meterRegistry, cache);
    }

    @Bean
    public TailerSettings tailerSettings() {
        TailerSettings settings = TailerSettings.builder(Path.of(filePath))
                .capacity(capacity)
                .minPollInterval(minPollInterval)
                .maxPollInterval(maxPollInterval)
                .backoffMultiplier(backoffMultiplier)
                .missingFileInterval(missingFileInterval)
                .errorCooldown(errorCooldown)
                .shutdownTimeout(shutdownTimeout)
                .build();
        log.info("Tailer configured: {}", settings);
        return settings;
    }

    /** Started by {@code StartupOrchestrator} once the context is ready, not here. */
    @Bean
    public FileTailer fileTailer(TailerSettings settings, LineDecoder decoder,
                                 EntryCache cache, TailMetrics metrics) {
        return new FileTailer(settings, decoder, cache, metrics);
    }

    @Bean
    public LogQueryService logQueryService(EntryCache cache) {
        return new LogQueryService(cache);
    }

    @Bean
    public StreamSessionManager streamSessionManager() {
        return new StreamSessionManager(streamPoolSize);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.taillens.common.model.LogRecord;
import com.taillens.common.model.RawRecord;
import com.taillens.common.model.StructuredRecord;
import com.taillens.common.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Decodes JSON-per-line log output (for example Python's {@code logging} with a JSON
 * formatter). A line holding a JSON object becomes a {@link StructuredRecord}; every
 * other line becomes a {@link RawRecord} stamped with the decode time.
 */
public class JsonLineDecoder implements LineDecoder {

    private static final Logger log = LoggerFactory.getLogger(JsonLineDecoder.class);

    private final Clock clock;

    public JsonLineDecoder() {
        this(Clock.systemUTC());
    }

    public JsonLineDecoder(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LogRecord decode(String line) {
        String trimmed = line.strip();
        if (trimmed.startsWith("{")) {
            try {
                Map<String, Object> fields = JsonUtil.parseObject(trimmed);
                return new StructuredRecord(fields);
            } catch (JsonProcessingException e) {
                log.trace("Line is not a JSON object, keeping raw text: {}", e.getOriginalMessage());
            } catch (RuntimeException e) {
                log.debug("Unexpected failure decoding line, keeping raw text: {}", e.getMessage());
            }
        }
        return new RawRecord(trimmed, clock.instant());
    }
}

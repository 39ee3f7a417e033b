/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.controller;

import com.taillens.common.model.ChangeSummary;
import com.taillens.common.model.LogPage;
import com.taillens.common.model.LogStats;
import com.taillens.server.query.LogFilter;
import com.taillens.server.query.LogQuery;
import com.taillens.server.query.LogQueryService;
import com.taillens.server.query.QueryParams;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API over the in-memory log window.
 * {@code level} and {@code category} may be repeated or comma-separated.
 */
@RestController
@RequestMapping("/api/v1/logs")
public class LogApiController {

    private final LogQueryService queryService;

    @Value("${taillens.query.default-page-size:100}")
    private int defaultPageSize;

    @Value("${taillens.query.max-page-size:1000}")
    private int maxPageSize;

    public LogApiController(LogQueryService queryService) {
        this.queryService = queryService;
    }

    /** GET /api/v1/logs - One page of entries, newest page when no start id is given. */
    @GetMapping
    public ResponseEntity<LogPage> getLogs(
            @RequestParam(name = "start_log_id", required = false) String startLogId,
            @RequestParam(name = "limit", required = false) String limit,
            @RequestParam(name = "level", required = false) List<String> levels,
            @RequestParam(name = "category", required = false) List<String> categories) {
        Long startId = QueryParams.parseId("start_log_id", startLogId);
        int pageSize = QueryParams.parseLimit("limit", limit, defaultPageSize, maxPageSize);
        LogFilter filter = filter(levels, categories);
        return ResponseEntity.ok(queryService.getLogs(new LogQuery(startId, pageSize, filter)));
    }

    /** GET /api/v1/logs/modules - Category tree keyed by parent path. */
    @GetMapping("/modules")
    public ResponseEntity<Map<String, Object>> getModules() {
        return ResponseEntity.ok(Map.of("hierarchy", queryService.getModuleHierarchy()));
    }

    /** GET /api/v1/logs/stats - Level and category counts. */
    @GetMapping("/stats")
    public ResponseEntity<LogStats> getStats(
            @RequestParam(name = "level", required = false) List<String> levels,
            @RequestParam(name = "category", required = false) List<String> categories) {
        return ResponseEntity.ok(queryService.getStats(filter(levels, categories)));
    }

    /** GET /api/v1/logs/changes - Whether entries newer than last_log_id are resident. */
    @GetMapping("/changes")
    public ResponseEntity<ChangeSummary> getChanges(
            @RequestParam(name = "last_log_id", required = false) String lastLogId) {
        Long lastKnownId = QueryParams.parseId("last_log_id", lastLogId);
        return ResponseEntity.ok(queryService.changesSince(lastKnownId == null ? -1 : lastKnownId));
    }

    private LogFilter filter(List<String> levels, List<String> categories) {
        Set<String> levelSet = QueryParams.parseLevels("level", splitCommas(levels));
        Set<String> categorySet = QueryParams.parseCategories("category", splitCommas(categories));
        return queryService.filter(levelSet, categorySet);
    }

    private static List<String> splitCommas(List<String> values) {
        List<String> parts = new ArrayList<>();
        if (values == null) return parts;
        for (String value : values) {
            if (value != null) parts.addAll(List.of(value.split(",")));
        }
        return parts;
    }
}

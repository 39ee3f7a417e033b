/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.controller;

import com.taillens.common.model.StructuredRecord;
import com.taillens.server.cache.EntryCache;
import com.taillens.server.cache.RecordFields;
import com.taillens.server.query.LogQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LogApiController.class)
@Import(LogApiControllerTest.EngineConfig.class)
class LogApiControllerTest {

    @TestConfiguration
    static class EngineConfig {
        @Bean
        EntryCache entryCache() {
            return new EntryCache(100, RecordFields.DEFAULT);
        }

        @Bean
        LogQueryService logQueryService(EntryCache cache) {
            return new LogQueryService(cache);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EntryCache cache;

    @BeforeEach
    void fill() {
        cache.reset(cache.generation() + 1);
        admit("user logged in", "INFO", "auth", "login");
        admit("bad password", "ERROR", "auth", "login");
        admit("pool exhausted", "ERROR", "db", null);
        admit("user logged out", "INFO", "auth", "logout");
    }

    private void admit(String message, String level, String module, String name) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("message", message);
        fields.put("levelname", level);
        fields.put("module", module);
        if (name != null) fields.put("name", name);
        cache.admit(new StructuredRecord(fields));
    }

    @Test
    void latestPageByDefault() throws Exception {
        long first = cache.minId();
        mockMvc.perform(get("/api/v1/logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logs", hasSize(4)))
                .andExpect(jsonPath("$.logs[0]._id").value(first))
                .andExpect(jsonPath("$.logs[0].message").value("user logged in"))
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.limit").value(100))
                .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    void pageFromStartId() throws Exception {
        long first = cache.minId();
        mockMvc.perform(get("/api/v1/logs")
                        .param("start_log_id", String.valueOf(first + 1))
                        .param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logs", hasSize(2)))
                .andExpect(jsonPath("$.logs[0].message").value("bad password"))
                .andExpect(jsonPath("$.start").value(first + 1))
                .andExpect(jsonPath("$.hasMore").value(true));
    }

    @Test
    void levelAndCategoryFilters() throws Exception {
        mockMvc.perform(get("/api/v1/logs").param("level", "error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logs", hasSize(2)))
                .andExpect(jsonPath("$.total").value(2));

        mockMvc.perform(get("/api/v1/logs").param("category", "auth.login,auth.logout").param("level", "INFO"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logs", hasSize(2)))
                .andExpect(jsonPath("$.logs[1].message").value("user logged out"));
    }

    @Test
    void invalidParametersAreBadRequests() throws Exception {
        mockMvc.perform(get("/api/v1/logs").param("level", "LOUD"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TL_INVALID_QUERY"))
                .andExpect(jsonPath("$.parameter").value("level"));

        mockMvc.perform(get("/api/v1/logs").param("start_log_id", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("start_log_id"));

        mockMvc.perform(get("/api/v1/logs").param("limit", "5000"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/logs").param("category", "auth..login"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void moduleHierarchy() throws Exception {
        mockMvc.perform(get("/api/v1/logs/modules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hierarchy.root", hasSize(2)))
                .andExpect(jsonPath("$.hierarchy.root[0]").value("auth"))
                .andExpect(jsonPath("$.hierarchy.auth", hasSize(2)));
    }

    @Test
    void stats() throws Exception {
        mockMvc.perform(get("/api/v1/logs/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEntries").value(4))
                .andExpect(jsonPath("$.levelCounts.ERROR").value(2))
                .andExpect(jsonPath("$.categoryCounts['auth.login']").value(2));
    }

    @Test
    void changesSinceLastKnownId() throws Exception {
        long max = cache.maxId();
        mockMvc.perform(get("/api/v1/logs/changes").param("last_log_id", String.valueOf(max - 1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.has_updates").value(true))
                .andExpect(jsonPath("$.new_count").value(1))
                .andExpect(jsonPath("$.max_id").value(max));

        mockMvc.perform(get("/api/v1/logs/changes").param("last_log_id", String.valueOf(max)))
                .andExpect(jsonPath("$.has_updates").value(false));
    }
}

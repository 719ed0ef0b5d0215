package com.autonomous.commit.controller;

import com.autonomous.commit.model.CacheStats;
import com.autonomous.commit.service.CacheManager;
import com.autonomous.commit.service.TelemetryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EngineController.class)
class EngineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TelemetryService telemetry;

    @MockBean
    private CacheManager cacheManager;

    @Test
    void shouldReturnStatsSnapshot() throws Exception {
        when(telemetry.snapshot()).thenReturn(Map.of("cache", CacheStats.builder()
            .hits(3)
            .misses(1)
            .entryCount(2)
            .build()));

        mockMvc.perform(get("/engine/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cache.hits").value(3))
            .andExpect(jsonPath("$.cache.entryCount").value(2))
            .andExpect(jsonPath("$.cache.hitRate").value(0.75));
    }

    @Test
    void shouldReturnHealth() throws Exception {
        when(telemetry.health()).thenReturn(Map.of("status", "healthy", "memory_pressure", "LOW"));

        mockMvc.perform(get("/engine/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void shouldClearCacheByPrefix() throws Exception {
        when(cacheManager.clearPrefix("diff:")).thenReturn(4);
        when(telemetry.formatCacheSummary()).thenReturn("Cache: 0 entries, 0% hit rate, 0 B");

        mockMvc.perform(post("/engine/cache/clear").param("prefix", "diff:"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(4))
            .andExpect(jsonPath("$.summary").value("Cache: 0 entries, 0% hit rate, 0 B"));
    }

    @Test
    void shouldClearWholeCacheWithoutPrefix() throws Exception {
        when(cacheManager.clearPrefix("")).thenReturn(10);
        when(telemetry.formatCacheSummary()).thenReturn("Cache: 0 entries, 0% hit rate, 0 B");

        mockMvc.perform(post("/engine/cache/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(10))
            .andExpect(jsonPath("$.summary").value("Cache: 0 entries, 0% hit rate, 0 B"));

        verify(cacheManager).clearPrefix("");
    }

    @Test
    void shouldForceMemoryCleanup() throws Exception {
        when(cacheManager.forceMemoryCleanup()).thenReturn(2048L);
        when(telemetry.formatMemorySummary()).thenReturn("Memory: 0 B / 1000 B (0%, LOW), peak 2.0 KB");

        mockMvc.perform(post("/engine/memory/cleanup"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.freed_bytes").value(2048));
    }
}

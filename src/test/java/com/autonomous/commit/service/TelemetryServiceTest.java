package com.autonomous.commit.service;

import com.autonomous.commit.config.CacheConfig;
import com.autonomous.commit.config.MemoryConfig;
import com.autonomous.commit.config.ParallelConfig;
import com.autonomous.commit.model.AllocationCategory;
import com.autonomous.commit.model.ScheduledTask;
import com.autonomous.commit.model.TaskMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryServiceTest {

    private MemoryManager memoryManager;
    private ParallelProcessor processor;
    private CacheManager cache;
    private TelemetryService telemetry;

    @BeforeEach
    void setUp() {
        memoryManager = new MemoryManager(MemoryConfig.builder().maxMemoryUsage(1000).backgroundCleanup(false).build());
        processor = new ParallelProcessor(ParallelConfig.builder().maxConcurrentTasks(2).maxRetries(0).build());
        cache = new CacheManager(CacheConfig.defaults(), memoryManager, processor);
        telemetry = new TelemetryService(cache, memoryManager, processor);
    }

    @AfterEach
    void tearDown() {
        cache.close();
        processor.close();
        memoryManager.close();
    }

    @Test
    void shouldFormatBytes() {
        assertEquals("512 B", TelemetryService.formatBytes(512));
        assertTrue(TelemetryService.formatBytes(2048).endsWith(" KB"));
        assertTrue(TelemetryService.formatBytes(5L * 1024 * 1024).endsWith(" MB"));
        assertTrue(TelemetryService.formatBytes(3L * 1024 * 1024 * 1024).endsWith(" GB"));
    }

    @Test
    void shouldSummarizeCache() throws Exception {
        cache.set("k", "value");
        cache.get("k", String.class);
        cache.get("missing", String.class);

        assertEquals("Cache: 1 entries, 50% hit rate, 7 B", telemetry.formatCacheSummary());
    }

    @Test
    void shouldSummarizeMemory() throws Exception {
        memoryManager.allocate("buffer", 600, AllocationCategory.TEMPORARY_BUFFER);

        String summary = telemetry.formatMemorySummary();

        assertTrue(summary.startsWith("Memory: 600 B / 1000 B (60%, MEDIUM)"), summary);
    }

    @Test
    void shouldSummarizeProcessor() {
        processor.processWithScheduler(List.of(
            ScheduledTask.of(TaskMetadata.of("ok"), "ok"),
            ScheduledTask.of(TaskMetadata.of("bad"), "bad")), id -> {
                if (id.equals("bad")) {
                    throw new IllegalStateException("bad");
                }
                return id;
            });

        assertTrue(telemetry.formatProcessorSummary().startsWith("Tasks: 1 done, 1 failed, 0 retried, 0 running"));
    }

    @Test
    void shouldReportDegradedHealthAtCriticalPressure() throws Exception {
        assertEquals("healthy", telemetry.health().get("status"));

        memoryManager.allocate("big", 950, AllocationCategory.FILE_CONTENT);

        Map<String, Object> health = telemetry.health();
        assertEquals("degraded", health.get("status"));
        assertEquals("CRITICAL", health.get("memory_pressure"));
        assertEquals(0, health.get("active_tasks"));
    }

    @Test
    void shouldSnapshotAllComponents() {
        Map<String, Object> snapshot = telemetry.snapshot();

        assertEquals(List.of("cache", "memory", "processor"), List.copyOf(snapshot.keySet()));
    }
}

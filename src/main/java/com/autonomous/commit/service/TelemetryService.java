package com.autonomous.commit.service;

import com.autonomous.commit.model.CacheStats;
import com.autonomous.commit.model.MemoryPressure;
import com.autonomous.commit.model.MemoryStats;
import com.autonomous.commit.model.ParallelStats;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One-line status summaries of the cache, memory manager and processor, for status bars and
 * the {@code /engine} endpoints.
 */
@Service
public class TelemetryService {

    private final CacheManager cacheManager;
    private final MemoryManager memoryManager;
    private final ParallelProcessor processor;

    public TelemetryService(CacheManager cacheManager, MemoryManager memoryManager, ParallelProcessor processor) {
        this.cacheManager = cacheManager;
        this.memoryManager = memoryManager;
        this.processor = processor;
    }

    public String formatCacheSummary() {
        CacheStats stats = cacheManager.stats();
        return String.format("Cache: %d entries, %.0f%% hit rate, %s",
            stats.getEntryCount(),
            stats.getHitRate() * 100.0,
            formatBytes(stats.getMemoryUsage()));
    }

    public String formatMemorySummary() {
        MemoryStats stats = memoryManager.getStats();
        return String.format("Memory: %s / %s (%.0f%%, %s), peak %s",
            formatBytes(stats.getCurrentUsage()),
            formatBytes(memoryManager.getConfig().getMaxMemoryUsage()),
            memoryManager.getUsagePercentage(),
            memoryManager.getMemoryPressure(),
            formatBytes(stats.getPeakUsage()));
    }

    public String formatProcessorSummary() {
        ParallelStats stats = processor.getStats();
        return String.format("Tasks: %d done, %d failed, %d retried, %d running, avg %dms, %.1f/s",
            stats.getCompletedTasks(),
            stats.getFailedTasks(),
            stats.getRetriedTasks(),
            stats.getCurrentActiveTasks(),
            stats.getAverageExecutionTime().toMillis(),
            stats.getThroughputPerSecond());
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("cache", cacheManager.stats());
        snapshot.put("memory", memoryManager.getStats());
        snapshot.put("processor", processor.getStats());
        return snapshot;
    }

    /**
     * {@code degraded} once memory pressure is critical.
     */
    public Map<String, Object> health() {
        MemoryPressure pressure = memoryManager.getMemoryPressure();
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", pressure == MemoryPressure.CRITICAL ? "degraded" : "healthy");
        health.put("memory_pressure", pressure.name());
        health.put("active_tasks", processor.getResourceMonitor().getCurrentUsage().getActiveTasks());
        return health;
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        } else if (bytes < 1024 * 1024) {
            return String.format("%.1f KB", bytes / 1024.0);
        } else if (bytes < 1024L * 1024 * 1024) {
            return String.format("%.1f MB", bytes / (1024.0 * 1024));
        }
        return String.format("%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }
}

package com.autonomous.commit.config;

import com.autonomous.commit.model.EvictionStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @Test
    void shouldHaveDocumentedDefaults() {
        EngineSettings settings = EngineSettings.defaults();

        assertEquals(500L * 1024 * 1024, settings.getMemory().getMaxMemoryUsage());
        assertEquals(Duration.ofSeconds(30), settings.getMemory().getCleanupInterval());
        assertEquals(64 * 1024, settings.getMemory().getStreamBufferSize());
        assertTrue(settings.getParallel().getMaxConcurrentTasks() >= 4);
        assertEquals(300, settings.getParallel().getTaskTimeoutSeconds());
        assertEquals(3, settings.getParallel().getMaxRetries());
        assertEquals(512L * 1024 * 1024, settings.getParallel().memoryLimitBytes());
        assertEquals(Duration.ofHours(1), settings.getCache().getDefaultTtl());
        assertFalse(settings.getCache().isEnableFsCache());
        assertEquals(EvictionStrategy.LRU, settings.getCache().getEvictionStrategy());
        assertEquals(10L * 1024 * 1024, settings.getCache().getMaxEntrySize());
        assertFalse(settings.getCache().isAdaptiveTtl());
    }

    @Test
    void shouldComputeCleanupThresholdInBytes() {
        MemoryConfig config = MemoryConfig.builder().maxMemoryUsage(1000).cleanupThresholdPercent(0.75).build();

        assertEquals(750, config.cleanupThresholdBytes());
    }

    @Test
    void shouldDeriveMemoryConfigFromCacheConfig() {
        CacheConfig cache = CacheConfig.builder()
            .maxMemoryUsage(4096)
            .cleanupInterval(Duration.ofMinutes(1))
            .evictionStrategy(EvictionStrategy.FIFO)
            .build();

        MemoryConfig memory = cache.toMemoryConfig();
        assertEquals(EvictionStrategy.FIFO, memory.getEvictionStrategy());

        assertEquals(4096, memory.getMaxMemoryUsage());
        assertEquals(Duration.ofMinutes(1), memory.getCleanupInterval());
    }

    @Test
    void shouldRejectInvalidConfigs() {
        assertThrows(IllegalArgumentException.class,
            () -> MemoryConfig.builder().maxMemoryUsage(0).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> MemoryConfig.builder().cleanupThresholdPercent(1.5).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> MemoryConfig.builder().mediumPressurePercent(80).highPressurePercent(70).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> ParallelConfig.builder().batchSize(0).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> ParallelConfig.builder().maxRetries(-1).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> CacheConfig.builder().memoryCacheSize(0).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> CacheConfig.builder().enableFsCache(true).fsCacheDir(" ").build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> CacheConfig.builder().maxEntrySize(0).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> CacheConfig.builder().evictionStrategy(null).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> MemoryConfig.builder().evictionStrategy(null).build().validate());
    }
}

package com.autonomous.commit.service;

import com.autonomous.commit.config.EngineSettings;
import com.autonomous.commit.model.EvictionStrategy;
import com.autonomous.commit.model.MemoryPressure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigLoaderServiceTest {

    private EngineConfigLoaderService configLoader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        configLoader = new EngineConfigLoaderService();
        configLoader.setConfigPath(tempDir.resolve("engine.yaml").toString());
    }

    @Test
    void shouldLoadSettingsFromYaml() throws Exception {
        File configFile = tempDir.resolve("engine.yaml").toFile();
        try (FileWriter writer = new FileWriter(configFile)) {
            writer.write("memory:\n");
            writer.write("  max_memory_usage: 2097152\n");
            writer.write("  cleanup_interval: PT10S\n");
            writer.write("  cleanup_trigger_pressure: CRITICAL\n");
            writer.write("parallel:\n");
            writer.write("  max_concurrent_tasks: 6\n");
            writer.write("  retry_delay_ms: 250\n");
            writer.write("cache:\n");
            writer.write("  enable_fs_cache: true\n");
            writer.write("  fs_cache_dir: /tmp/commit-cache\n");
            writer.write("  default_ttl: PT15M\n");
            writer.write("  eviction_strategy: LFU\n");
            writer.write("  uncached_prefixes: [\"tmp:\"]\n");
            writer.write("  ttl_by_prefix:\n");
            writer.write("    \"status:\": PT30S\n");
        }

        EngineSettings settings = configLoader.load();

        assertEquals(2_097_152, settings.getMemory().getMaxMemoryUsage());
        assertEquals(Duration.ofSeconds(10), settings.getMemory().getCleanupInterval());
        assertEquals(MemoryPressure.CRITICAL, settings.getMemory().getCleanupTriggerPressure());
        assertEquals(0.8, settings.getMemory().getCleanupThresholdPercent());
        assertEquals(6, settings.getParallel().getMaxConcurrentTasks());
        assertEquals(250, settings.getParallel().getRetryDelayMs());
        assertEquals(10, settings.getParallel().getBatchSize());
        assertTrue(settings.getCache().isEnableFsCache());
        assertEquals(Duration.ofMinutes(15), settings.getCache().getDefaultTtl());
        assertEquals(1000, settings.getCache().getMemoryCacheSize());
        assertEquals(EvictionStrategy.LFU, settings.getCache().getEvictionStrategy());
        assertEquals(List.of("tmp:"), settings.getCache().getUncachedPrefixes());
        assertEquals(Duration.ofSeconds(30), settings.getCache().getTtlByPrefix().get("status:"));
        assertEquals(EvictionStrategy.LRU, settings.getMemory().getEvictionStrategy());
    }

    @Test
    void shouldUseDefaultsWhenFileIsMissing() {
        EngineSettings settings = configLoader.load();

        assertEquals(EngineSettings.defaults(), settings);
    }

    @Test
    void shouldUseDefaultsForMissingSections() throws Exception {
        try (FileWriter writer = new FileWriter(tempDir.resolve("engine.yaml").toFile())) {
            writer.write("parallel:\n");
            writer.write("  batch_size: 25\n");
        }

        EngineSettings settings = configLoader.load();

        assertEquals(25, settings.getParallel().getBatchSize());
        assertEquals(500L * 1024 * 1024, settings.getMemory().getMaxMemoryUsage());
    }

    @Test
    void shouldRejectInvalidValues() throws Exception {
        try (FileWriter writer = new FileWriter(tempDir.resolve("engine.yaml").toFile())) {
            writer.write("parallel:\n");
            writer.write("  max_concurrent_tasks: 0\n");
        }

        IllegalStateException error = assertThrows(IllegalStateException.class, configLoader::load);

        assertTrue(error.getMessage().contains("max_concurrent_tasks"));
    }

    @Test
    void shouldRejectMalformedYaml() throws Exception {
        try (FileWriter writer = new FileWriter(tempDir.resolve("engine.yaml").toFile())) {
            writer.write("memory: [not, a, map\n");
        }

        assertThrows(IllegalStateException.class, configLoader::load);
    }
}

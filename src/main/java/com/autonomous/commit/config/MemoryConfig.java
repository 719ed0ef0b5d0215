package com.autonomous.commit.config;

import com.autonomous.commit.model.EvictionStrategy;
import com.autonomous.commit.model.MemoryPressure;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Budget and housekeeping settings for a {@link com.autonomous.commit.service.MemoryManager}.
 * Pressure thresholds are percentages of {@link #maxMemoryUsage}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MemoryConfig {

    @Builder.Default
    long maxMemoryUsage = 500L * 1024 * 1024;

    /** Fraction of the budget at which cleanup kicks in, and the level it evicts down to. */
    @Builder.Default
    double cleanupThresholdPercent = 0.8;

    @Builder.Default
    Duration cleanupInterval = Duration.ofSeconds(30);

    @Builder.Default
    boolean trackAllocations = true;

    @Builder.Default
    long largeFileThreshold = 10L * 1024 * 1024;

    @Builder.Default
    int streamBufferSize = 64 * 1024;

    @Builder.Default
    double mediumPressurePercent = 50.0;

    @Builder.Default
    double highPressurePercent = 75.0;

    @Builder.Default
    double criticalPressurePercent = 90.0;

    @Builder.Default
    MemoryPressure cleanupTriggerPressure = MemoryPressure.HIGH;

    @Builder.Default
    boolean backgroundCleanup = true;

    /** Order within a category rank; {@code TTL} falls back to oldest first. */
    @Builder.Default
    EvictionStrategy evictionStrategy = EvictionStrategy.LRU;

    public static MemoryConfig defaults() {
        return MemoryConfig.builder().build();
    }

    public long cleanupThresholdBytes() {
        return (long) (maxMemoryUsage * cleanupThresholdPercent);
    }

    public void validate() {
        if (maxMemoryUsage <= 0) {
            throw new IllegalArgumentException("max_memory_usage must be positive: " + maxMemoryUsage);
        }
        if (cleanupThresholdPercent <= 0.0 || cleanupThresholdPercent > 1.0) {
            throw new IllegalArgumentException(
                "cleanup_threshold_percent must be in (0, 1]: " + cleanupThresholdPercent);
        }
        if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanup_interval must be positive: " + cleanupInterval);
        }
        if (streamBufferSize <= 0) {
            throw new IllegalArgumentException("stream_buffer_size must be positive: " + streamBufferSize);
        }
        if (largeFileThreshold < 0) {
            throw new IllegalArgumentException("large_file_threshold must not be negative: " + largeFileThreshold);
        }
        if (!(mediumPressurePercent <= highPressurePercent && highPressurePercent <= criticalPressurePercent)) {
            throw new IllegalArgumentException(String.format(
                "pressure thresholds must be ordered: medium=%.1f high=%.1f critical=%.1f",
                mediumPressurePercent, highPressurePercent, criticalPressurePercent));
        }
        if (cleanupTriggerPressure == null) {
            throw new IllegalArgumentException("cleanup_trigger_pressure must be set");
        }
        if (evictionStrategy == null) {
            throw new IllegalArgumentException("eviction_strategy must be set");
        }
    }
}

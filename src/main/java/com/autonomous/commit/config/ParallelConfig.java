package com.autonomous.commit.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ParallelConfig {

    @Builder.Default
    int maxConcurrentTasks = Math.max(4, Runtime.getRuntime().availableProcessors());

    @Builder.Default
    int batchSize = 10;

    @Builder.Default
    long taskTimeoutSeconds = 300;

    @Builder.Default
    boolean enableTaskGrouping = true;

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    long retryDelayMs = 1000;

    @Builder.Default
    long memoryLimitMb = 512;

    public static ParallelConfig defaults() {
        return ParallelConfig.builder().build();
    }

    public long memoryLimitBytes() {
        return memoryLimitMb * 1024 * 1024;
    }

    public void validate() {
        if (maxConcurrentTasks <= 0) {
            throw new IllegalArgumentException("max_concurrent_tasks must be positive: " + maxConcurrentTasks);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batch_size must be positive: " + batchSize);
        }
        if (taskTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("task_timeout_seconds must be positive: " + taskTimeoutSeconds);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max_retries must not be negative: " + maxRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retry_delay_ms must not be negative: " + retryDelayMs);
        }
        if (memoryLimitMb <= 0) {
            throw new IllegalArgumentException("memory_limit_mb must be positive: " + memoryLimitMb);
        }
    }
}

package com.autonomous.commit.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Root of the engine YAML file. Each section falls back to its defaults when absent.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EngineSettings {

    @Builder.Default
    MemoryConfig memory = MemoryConfig.defaults();

    @Builder.Default
    ParallelConfig parallel = ParallelConfig.defaults();

    @Builder.Default
    CacheConfig cache = CacheConfig.defaults();

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }

    public void validate() {
        memory.validate();
        parallel.validate();
        cache.validate();
    }
}

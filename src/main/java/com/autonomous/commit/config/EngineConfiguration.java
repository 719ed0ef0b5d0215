package com.autonomous.commit.config;

import com.autonomous.commit.service.CacheManager;
import com.autonomous.commit.service.EngineConfigLoaderService;
import com.autonomous.commit.service.MemoryManager;
import com.autonomous.commit.service.ParallelProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one memory manager shared by the processor and the cache.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public EngineSettings engineSettings(EngineConfigLoaderService loader) {
        return loader.load();
    }

    @Bean(destroyMethod = "close")
    public MemoryManager memoryManager(EngineSettings settings) {
        return new MemoryManager(settings.getMemory());
    }

    @Bean(destroyMethod = "close")
    public ParallelProcessor parallelProcessor(EngineSettings settings, MemoryManager memoryManager) {
        return new ParallelProcessor(settings.getParallel(), memoryManager);
    }

    @Bean(destroyMethod = "close")
    public CacheManager cacheManager(EngineSettings settings, MemoryManager memoryManager,
                                     ParallelProcessor parallelProcessor) {
        return new CacheManager(settings.getCache(), memoryManager, parallelProcessor);
    }
}

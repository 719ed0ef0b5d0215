package com.autonomous.commit.config;

import com.autonomous.commit.model.EvictionStrategy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class CacheConfig {

    /** Maximum number of in-memory entries before least-recently-used ones are dropped. */
    @Builder.Default
    int memoryCacheSize = 1000;

    @Builder.Default
    boolean enableFsCache = false;

    @Builder.Default
    String fsCacheDir = ".cache";

    @Builder.Default
    Duration defaultTtl = Duration.ofHours(1);

    /** Byte budget of the memory manager the cache charges its entries against. */
    @Builder.Default
    long maxMemoryUsage = 100L * 1024 * 1024;

    @Builder.Default
    Duration cleanupInterval = Duration.ofMinutes(5);

    @Builder.Default
    EvictionStrategy evictionStrategy = EvictionStrategy.LRU;

    /** Serialized values larger than this are not cached. */
    @Builder.Default
    long maxEntrySize = 10L * 1024 * 1024;

    @Builder.Default
    List<String> uncachedPrefixes = List.of();

    /** TTL for keys under a prefix; the longest matching prefix wins over {@link #defaultTtl}. */
    @Builder.Default
    Map<String, Duration> ttlByPrefix = Map.of();

    /** Doubles the default TTL for entries under 1 KiB and halves it for entries over 100 KiB. */
    @Builder.Default
    boolean adaptiveTtl = false;

    public static CacheConfig defaults() {
        return CacheConfig.builder().build();
    }

    /**
     * Memory manager settings derived from this cache's budget.
     */
    public MemoryConfig toMemoryConfig() {
        return MemoryConfig.builder()
            .maxMemoryUsage(maxMemoryUsage)
            .cleanupInterval(cleanupInterval)
            .evictionStrategy(evictionStrategy)
            .build();
    }

    public void validate() {
        if (memoryCacheSize <= 0) {
            throw new IllegalArgumentException("memory_cache_size must be positive: " + memoryCacheSize);
        }
        if (maxMemoryUsage <= 0) {
            throw new IllegalArgumentException("max_memory_usage must be positive: " + maxMemoryUsage);
        }
        if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanup_interval must be positive: " + cleanupInterval);
        }
        if (defaultTtl != null && defaultTtl.isNegative()) {
            throw new IllegalArgumentException("default_ttl must not be negative: " + defaultTtl);
        }
        if (evictionStrategy == null) {
            throw new IllegalArgumentException("eviction_strategy must be set");
        }
        if (maxEntrySize <= 0) {
            throw new IllegalArgumentException("max_entry_size must be positive: " + maxEntrySize);
        }
        if (uncachedPrefixes == null || ttlByPrefix == null) {
            throw new IllegalArgumentException("uncached_prefixes and ttl_by_prefix must not be null");
        }
        for (Map.Entry<String, Duration> ttl : ttlByPrefix.entrySet()) {
            if (ttl.getValue() == null || ttl.getValue().isNegative()) {
                throw new IllegalArgumentException("ttl_by_prefix." + ttl.getKey() + " must not be negative");
            }
        }
        if (enableFsCache && (fsCacheDir == null || fsCacheDir.isBlank())) {
            throw new IllegalArgumentException("fs_cache_dir is required when enable_fs_cache is set");
        }
    }
}

package com.autonomous.commit.service;

import com.autonomous.commit.config.CacheConfig;
import com.autonomous.commit.model.CacheEntry;
import com.autonomous.commit.model.EvictionStrategy;

import java.time.Duration;
import java.util.*;

/**
 * Admission, TTL and victim selection rules of a {@link CacheManager}.
 */
public class CacheStrategy {

    private static final long SMALL_ENTRY_BYTES = 1024;
    private static final long LARGE_ENTRY_BYTES = 100 * 1024;

    private final CacheConfig config;

    public CacheStrategy(CacheConfig config) {
        this.config = config;
    }

    public EvictionStrategy getEvictionStrategy() {
        return config.getEvictionStrategy();
    }

    public boolean shouldCache(String key, long size) {
        if (size > config.getMaxEntrySize()) {
            return false;
        }
        for (String prefix : config.getUncachedPrefixes()) {
            if (key.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    /**
     * TTL for a value stored without an explicit one. {@code null} means no expiry.
     */
    public Duration calculateTtl(String key, long size) {
        String match = null;
        for (String prefix : config.getTtlByPrefix().keySet()) {
            if (key.startsWith(prefix) && (match == null || prefix.length() > match.length())) {
                match = prefix;
            }
        }
        if (match != null) {
            return config.getTtlByPrefix().get(match);
        }

        Duration base = config.getDefaultTtl();
        if (base == null || !config.isAdaptiveTtl()) {
            return base;
        }
        if (size < SMALL_ENTRY_BYTES) {
            return base.multipliedBy(2);
        } else if (size > LARGE_ENTRY_BYTES) {
            return base.dividedBy(2);
        }
        return base;
    }

    /**
     * @param lruOrdered entries, least recently used first
     * @return the same entries, first victim first
     */
    List<CacheEntry> evictionOrder(Collection<CacheEntry> lruOrdered) {
        List<CacheEntry> ordered = new ArrayList<>(lruOrdered);
        switch (config.getEvictionStrategy()) {
            case LFU:
                // stable sort keeps LRU order among equal counts
                ordered.sort(Comparator.comparingLong(CacheEntry::getAccessCount));
                break;
            case FIFO:
                ordered.sort(Comparator.comparingLong(CacheEntry::getSequence));
                break;
            case TTL:
                ordered.sort(Comparator.comparing(CacheEntry::getExpiresAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparingLong(CacheEntry::getSequence));
                break;
            default:
                break;
        }
        return ordered;
    }
}

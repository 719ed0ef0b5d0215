package com.autonomous.commit.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    long hits;
    long misses;
    long evictions;
    long memoryUsage;
    int entryCount;

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}

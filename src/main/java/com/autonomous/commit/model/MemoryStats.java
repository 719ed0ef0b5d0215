package com.autonomous.commit.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class MemoryStats {
    long currentUsage;
    long peakUsage;
    long totalAllocations;
    long totalDeallocations;
    long cleanupOperations;
    long pressureEvents;
    double averageAllocationSize;
    Instant lastCleanup;
    Map<AllocationCategory, Long> usageByCategory;
}

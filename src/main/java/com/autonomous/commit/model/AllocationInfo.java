package com.autonomous.commit.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time copy of one allocation tracked by the memory manager.
 */
@Value
@Builder
public class AllocationInfo {
    String id;
    long size;
    AllocationCategory category;
    Instant createdAt;
    Instant lastAccessedAt;
    long accessCount;
    boolean pinned;
}

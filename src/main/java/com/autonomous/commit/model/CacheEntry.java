package com.autonomous.commit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Serialized cache value with its bookkeeping. {@code allocationId} names the memory manager
 * allocation that carries {@code size}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    private String key;
    private byte[] data;
    private long size;
    private Instant createdAt;
    private Instant lastAccessedAt;
    private Instant expiresAt;
    private long accessCount;
    private String allocationId;
    /** Insertion order within one cache; not persisted. */
    @JsonIgnore
    private long sequence;

    public static CacheEntry create(String key, byte[] data, Duration ttl, String allocationId) {
        Instant now = Instant.now();
        return CacheEntry.builder()
            .key(key)
            .data(data)
            .size(data.length)
            .createdAt(now)
            .lastAccessedAt(now)
            .expiresAt(ttl != null ? now.plus(ttl) : null)
            .allocationId(allocationId)
            .build();
    }

    @JsonIgnore
    public boolean isExpired() {
        return expiresAt != null && Instant.now().isAfter(expiresAt);
    }

    public synchronized void touch() {
        accessCount++;
        lastAccessedAt = Instant.now();
    }
}

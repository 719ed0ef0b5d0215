package com.autonomous.commit.model;

/**
 * Order in which evictable entries are chosen, within one category rank for the memory manager.
 */
public enum EvictionStrategy {
    LRU,
    LFU,
    /** Soonest expiry first; entries without a TTL go last. */
    TTL,
    FIFO
}

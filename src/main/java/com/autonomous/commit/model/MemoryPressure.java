package com.autonomous.commit.model;

/**
 * Coarse classification of memory usage against its budget. Declaration order is severity order.
 */
public enum MemoryPressure {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(MemoryPressure other) {
        return compareTo(other) >= 0;
    }
}

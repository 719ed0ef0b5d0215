package com.autonomous.commit.model;

/**
 * Dispatch priority among ready tasks. Declaration order is ascending priority.
 */
public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}

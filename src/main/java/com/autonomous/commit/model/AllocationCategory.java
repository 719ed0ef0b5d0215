package com.autonomous.commit.model;

public enum AllocationCategory {
    CACHE(0),
    ANALYSIS_RESULT(1),
    TEMPORARY_BUFFER(2),
    FILE_CONTENT(3),
    OTHER(4),
    CONFIGURATION(5);

    // lower ranks are evicted first
    private final int evictionRank;

    AllocationCategory(int evictionRank) {
        this.evictionRank = evictionRank;
    }

    public int getEvictionRank() {
        return evictionRank;
    }
}

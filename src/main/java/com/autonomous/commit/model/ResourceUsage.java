package com.autonomous.commit.model;

import lombok.Value;

@Value
public class ResourceUsage {
    long memoryBytes;
    int activeTasks;
}

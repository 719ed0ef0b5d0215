package com.autonomous.commit.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class ParallelStats {
    long totalTasks;
    long completedTasks;
    long failedTasks;
    long retriedTasks;
    Duration averageExecutionTime;
    long peakMemoryUsage;
    int currentActiveTasks;
    double throughputPerSecond;
}

package com.autonomous.commit.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class TaskMetadata {
    String id;

    @Builder.Default
    TaskPriority priority = TaskPriority.NORMAL;

    Duration estimatedDuration;

    /** Bytes the task needs while it runs; {@code null} means no memory admission check. */
    Long memoryRequirement;

    @Singular
    List<String> dependencies;

    String group;

    public static TaskMetadata of(String id) {
        return TaskMetadata.builder().id(id).build();
    }

    public Optional<String> getGroupName() {
        return Optional.ofNullable(group);
    }

    public long memoryRequirementOrZero() {
        return memoryRequirement != null ? memoryRequirement : 0L;
    }
}

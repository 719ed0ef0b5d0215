package com.autonomous.commit.model;

import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one submitted task. Exactly one of {@code value} and {@code error} is meaningful,
 * as reported by {@link #isSuccess()}.
 */
@Value
public class TaskResult<R> {
    String taskId;
    R value;
    TaskError error;
    Duration executionTime;
    int retryCount;
    Long memoryUsed;

    public static <R> TaskResult<R> success(String taskId, R value, Duration executionTime,
                                            int retryCount, Long memoryUsed) {
        return new TaskResult<>(taskId, value, null, executionTime, retryCount, memoryUsed);
    }

    public static <R> TaskResult<R> failure(String taskId, TaskError error, Duration executionTime,
                                            int retryCount, Long memoryUsed) {
        return new TaskResult<>(taskId, null, error, executionTime, retryCount, memoryUsed);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<R> getValueIfPresent() {
        return isSuccess() ? Optional.ofNullable(value) : Optional.empty();
    }

    public Optional<TaskErrorKind> getErrorKind() {
        return error == null ? Optional.empty() : Optional.of(error.getKind());
    }
}

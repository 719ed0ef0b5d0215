package com.autonomous.commit.model;

import lombok.Value;

@Value
public class TaskError {
    TaskErrorKind kind;
    String message;
    transient Throwable cause;

    public static TaskError timeout(long seconds) {
        return new TaskError(TaskErrorKind.TIMEOUT, "Task timed out after " + seconds + " seconds", null);
    }

    public static TaskError failed(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TaskError(TaskErrorKind.FAILED, message, cause);
    }

    public static TaskError dependencyFailed(String dependencyId) {
        return new TaskError(TaskErrorKind.DEPENDENCY_FAILED, "Dependency " + dependencyId + " failed", null);
    }

    public static TaskError retriesExhausted(int retries, TaskError last) {
        return new TaskError(TaskErrorKind.RETRIES_EXHAUSTED,
            String.format("Gave up after %d retries: %s", retries, last.getMessage()), last.getCause());
    }

    public static TaskError rejected(long required, long limit) {
        return new TaskError(TaskErrorKind.REJECTED,
            String.format("Memory requirement %d exceeds processor limit %d", required, limit), null);
    }
}

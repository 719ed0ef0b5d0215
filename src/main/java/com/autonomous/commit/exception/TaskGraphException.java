package com.autonomous.commit.exception;

/**
 * A submitted batch whose dependency graph cannot be scheduled: duplicate ids,
 * references to unknown tasks, or a cycle.
 */
public class TaskGraphException extends RuntimeException {

    public TaskGraphException(String message) {
        super(message);
    }
}

package com.autonomous.commit.model;

import lombok.Value;

/**
 * A task's metadata paired with the payload handed to the processing function.
 */
@Value
public class ScheduledTask<T> {
    TaskMetadata metadata;
    T payload;

    public static <T> ScheduledTask<T> of(TaskMetadata metadata, T payload) {
        return new ScheduledTask<>(metadata, payload);
    }

    public String getId() {
        return metadata.getId();
    }
}

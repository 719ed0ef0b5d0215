package com.autonomous.commit.service;

/**
 * Caller-supplied work run by the {@link ParallelProcessor} for each task payload.
 * The processor makes no assumption about side effects; a thrown exception is a failed attempt.
 */
@FunctionalInterface
public interface TaskFunction<T, R> {

    R apply(T payload) throws Exception;
}

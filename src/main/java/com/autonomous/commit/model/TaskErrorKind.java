package com.autonomous.commit.model;

public enum TaskErrorKind {
    TIMEOUT,
    FAILED,
    DEPENDENCY_FAILED,
    RETRIES_EXHAUSTED,
    // memory requirement larger than the whole processor budget
    REJECTED
}

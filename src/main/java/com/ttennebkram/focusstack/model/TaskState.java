package com.ttennebkram.focusstack.model;

/**
 * Lifecycle of a task. A task moves PENDING -> RUNNING -> SUCCEEDED or FAILED, once.
 * A task can also be skipped straight from PENDING to FAILED.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    /**
     * True for SUCCEEDED and FAILED. Dependents treat both as completed.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}

package com.imageanalysis.shared.model;

/**
 * Status of a single analysis task. SUCCEEDED and FAILED are terminal,
 * TIMED_OUT marks a timed-out attempt that is waiting for its retry.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}

package com.sailfish.interop.task;

/**
 * Represents the possible states of a background task.
 */
public enum TaskState {
    /**
     * Task has been submitted and is waiting for its loop to start it.
     */
    PENDING,
    /**
     * Task has been started on its loop and has not finished yet.
     */
    RUNNING,
    /**
     * Task completed successfully.
     */
    COMPLETED,
    /**
     * Task completed with a failure.
     */
    FAILED,
    /**
     * Task was cancelled before completing, either explicitly or because its loop closed.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}

package com.sailfish.interop;

/**
 * Thrown by blocking entry points when scheduled or offloaded work failed with a checked exception.
 * The original exception is always available as the cause; unchecked failures are rethrown as-is
 * and never wrapped.
 */
public class WorkFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public WorkFailedException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}

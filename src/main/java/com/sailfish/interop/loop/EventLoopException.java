package com.sailfish.interop.loop;

/**
 * Raised when an event loop, or a thread hosting one, cannot be started, stopped or waited on.
 */
public class EventLoopException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventLoopException(String message) {
        super(message);
    }

    public EventLoopException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.sailfish.interop.bridge;

import com.sailfish.interop.AsyncWork;

/**
 * Runs scheduled work to completion from blocking code.
 */
public interface SchedulerBridge {

    /**
     * Drives the work to completion and returns its result, blocking the calling thread.
     *
     * When no event loop is running on the calling thread, a fresh loop runs the work right here.
     * When one is, running the work on this thread would re-enter that loop, so a fresh loop runs it
     * on an isolated thread instead and the caller blocks until that thread has been joined.
     *
     * @param work The work to run.
     * @param <T>  The type of the work's result.
     * @return The work's result.
     * @throws com.sailfish.interop.WorkFailedException if the work failed with a checked exception;
     *         unchecked failures are rethrown unmodified.
     * @throws com.sailfish.interop.loop.EventLoopException if a loop or the isolated thread could not
     *         be started or waited on.
     */
    <T> T runToCompletion(AsyncWork<T> work);
}

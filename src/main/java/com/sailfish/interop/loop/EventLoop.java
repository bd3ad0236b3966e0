package com.sailfish.interop.loop;

import com.sailfish.interop.AsyncWork;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * A cooperative single-threaded scheduler. All callbacks submitted to a loop run one at a time on
 * the thread that is driving it; work only switches at the points where it waits on a stage.
 */
public interface EventLoop extends Executor, AutoCloseable {

    /**
     * Binds this loop to the calling thread, runs the work to completion and closes the loop.
     *
     * @param work The work to drive.
     * @param <T>  The type of the work's result.
     * @return The work's result.
     * @throws EventLoopException if the loop cannot be started on this thread.
     * @throws com.sailfish.interop.WorkFailedException if the work failed with a checked exception;
     *         unchecked failures are rethrown unmodified.
     */
    <T> T runUntilComplete(AsyncWork<T> work);

    /**
     * Enqueues a callback to run on the loop thread. Safe to call from any thread.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the loop is closed.
     */
    @Override
    void execute(Runnable task);

    /**
     * Runs the callback on the loop thread once the delay has elapsed.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the loop is closed.
     */
    void schedule(Runnable task, Duration delay);

    /**
     * @return true if the calling thread is the one driving this loop.
     */
    boolean inEventLoop();

    boolean isRunning();

    boolean isClosed();

    /**
     * Registers a hook run on the loop thread when the loop is torn down.
     *
     * @param hook The hook.
     * @return An action that deregisters the hook.
     * @throws java.util.concurrent.RejectedExecutionException if the loop is closed.
     */
    Runnable onClose(Runnable hook);

    /**
     * Closes the loop, discarding queued callbacks and timers. Idempotent.
     *
     * @throws EventLoopException if the loop is still running.
     */
    @Override
    void close();
}

package com.sailfish.interop.offload;

import com.sailfish.interop.AsyncWork;

import java.util.concurrent.Callable;

/**
 * Moves blocking calls off the event loop thread so scheduled code can await them.
 */
public interface BlockingCallOffloader {

    /**
     * Wraps a blocking call as work that, once started on a loop, runs the call on a worker thread
     * and completes on the loop thread with its result. Awaiting it suspends only the awaiting work,
     * never the loop.
     *
     * Whatever the call throws is delivered unmodified as the work's failure.
     *
     * @param call The blocking call.
     * @param <T>  The call's result type.
     * @return The work wrapping the call; each start submits a new job.
     */
    <T> AsyncWork<T> runBlocking(Callable<T> call);

    /**
     * As {@link #runBlocking(Callable)}, binding the argument to the function.
     */
    default <A, T> AsyncWork<T> runBlocking(BlockingFunction<? super A, ? extends T> function, A argument) {
        return runBlocking(() -> function.apply(argument));
    }

    /**
     * Initiates a graceful shutdown of the worker threads.
     *
     * @param timeoutSeconds Time to wait for running calls to complete before forcing shutdown.
     */
    void shutdown(long timeoutSeconds);
}

package com.sailfish.interop.support;

import com.sailfish.interop.WorkFailedException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Helpers for surfacing work failures to blocking callers without altering them.
 *
 * Each hand-off removes only the wrapper it added itself, so an exception raised by the work keeps
 * its identity even when it is a {@link CompletionException} or
 * {@link java.util.concurrent.ExecutionException}.
 */
public final class Failures {

    private Failures() {
    }

    /**
     * Removes the single {@link CompletionException} a {@link CompletableFuture} adds when a failure
     * passes through a dependent stage. Anything else is returned as is.
     */
    public static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    /**
     * Returns the exception the future was completed with, exactly as stored, or null if it completed
     * normally.
     *
     * @throws IllegalStateException if the future is not done yet.
     */
    public static Throwable failureOf(CompletableFuture<?> done) {
        if (!done.isDone()) {
            throw new IllegalStateException("Future has not completed yet");
        }
        AtomicReference<Throwable> failure = new AtomicReference<>();
        // Runs immediately on a completed future
        done.whenComplete((value, error) -> failure.set(error));
        return failure.get();
    }

    /**
     * Rethrows the failure. Unchecked failures are thrown as the same instance, checked ones are
     * wrapped once in {@link WorkFailedException}.
     *
     * @return never returns normally; declared so callers can write {@code throw Failures.rethrow(e)}.
     */
    public static RuntimeException rethrow(Throwable failure) {
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new WorkFailedException(failure);
    }
}

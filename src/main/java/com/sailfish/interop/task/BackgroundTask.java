package com.sailfish.interop.task;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.loop.EventLoop;
import com.sailfish.interop.support.Failures;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Handle of a fire-and-forget task. Callers may drop it: the {@link BackgroundTaskRegistry} that
 * created it keeps it reachable until it completes, fails or is cancelled.
 *
 * @param <T> The type of the task's result.
 */
public final class BackgroundTask<T> {

    private final long id;
    private final String description;
    private final Instant submittedAt;
    private final CompletableFuture<T> completion = new CompletableFuture<>();

    private volatile boolean started;
    private volatile CompletableFuture<T> running;

    BackgroundTask(long id, String description) {
        this.id = id;
        this.description = description;
        this.submittedAt = Instant.now();
    }

    /**
     * Starts the work. Runs on the loop thread.
     */
    void start(AsyncWork<T> work, EventLoop loop) {
        if (completion.isDone()) {
            return; // cancelled before the loop got to it
        }
        started = true;
        CompletionStage<T> stage;
        try {
            stage = work.start(loop);
        } catch (Throwable e) {
            // Captured by the handle; nothing a background task throws may reach the loop
            completion.completeExceptionally(e);
            return;
        }
        if (stage == null) {
            completion.completeExceptionally(new NullPointerException("work returned a null stage"));
            return;
        }
        CompletableFuture<T> future = stage.toCompletableFuture();
        running = future;
        future.whenComplete((value, failure) -> {
            if (failure != null) {
                completion.completeExceptionally(Failures.unwrap(failure));
            } else {
                completion.complete(value);
            }
        });
        if (completion.isCancelled()) {
            future.cancel(false);
        }
    }

    CompletableFuture<T> future() {
        return completion;
    }

    void fail(Throwable failure) {
        completion.completeExceptionally(failure);
    }

    /**
     * Cancels the task if it has not finished yet.
     *
     * @return true if this call cancelled the task.
     */
    public boolean cancel() {
        boolean cancelled = completion.cancel(false);
        CompletableFuture<T> future = running;
        if (cancelled && future != null) {
            future.cancel(false);
        }
        return cancelled;
    }

    public long getId() {
        return id;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public TaskState state() {
        if (completion.isCancelled()) {
            return TaskState.CANCELLED;
        }
        if (completion.isCompletedExceptionally()) {
            return TaskState.FAILED;
        }
        if (completion.isDone()) {
            return TaskState.COMPLETED;
        }
        return started ? TaskState.RUNNING : TaskState.PENDING;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * @return The failure the task completed with; empty while running, on success and on cancellation.
     */
    public Optional<Throwable> failure() {
        if (!completion.isDone() || completion.isCancelled()) {
            return Optional.empty();
        }
        return Optional.ofNullable(Failures.failureOf(completion));
    }

    /**
     * @return A stage that settles with the task's outcome.
     */
    public CompletionStage<T> completion() {
        return completion.minimalCompletionStage();
    }

    @Override
    public String toString() {
        return description == null
                ? "BackgroundTask[" + id + ", " + state() + "]"
                : "BackgroundTask[" + id + " '" + description + "', " + state() + "]";
    }
}

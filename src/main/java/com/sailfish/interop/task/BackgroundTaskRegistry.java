package com.sailfish.interop.task;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.loop.EventLoop;
import com.sailfish.interop.loop.EventLoops;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds strong references to background tasks from submission until they reach a terminal state,
 * so that fire-and-forget work is never lost because its caller dropped the handle.
 *
 * Membership has no effect on how a task runs; it only keeps the task alive.
 */
public class BackgroundTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskRegistry.class);

    private static final BackgroundTaskRegistry GLOBAL = new BackgroundTaskRegistry();

    private final Set<BackgroundTask<?>> tasks = ConcurrentHashMap.newKeySet();
    private final AtomicLong taskIds = new AtomicLong();

    /**
     * @return The process-wide registry.
     */
    public static BackgroundTaskRegistry global() {
        return GLOBAL;
    }

    /**
     * Submits work on the event loop running on the calling thread.
     *
     * @throws IllegalStateException if no event loop is running on this thread.
     */
    public <T> BackgroundTask<T> submit(AsyncWork<T> work) {
        EventLoop loop = EventLoops.current().orElseThrow(() -> new IllegalStateException(
                "No event loop is running on thread " + Thread.currentThread().getName()));
        return submit(loop, work, null);
    }

    public <T> BackgroundTask<T> submit(EventLoop loop, AsyncWork<T> work) {
        return submit(loop, work, null);
    }

    /**
     * Starts the work on the given loop without waiting for it and retains the task until it is done.
     * Failures of the work are captured by the returned handle and never thrown from here.
     *
     * @param loop        The loop to run the work on.
     * @param work        The work.
     * @param description Optional description used in log messages.
     * @return The task handle; callers may discard it.
     * @throws RejectedExecutionException if the loop is already closed.
     */
    public <T> BackgroundTask<T> submit(EventLoop loop, AsyncWork<T> work, String description) {
        Objects.requireNonNull(loop, "loop cannot be null");
        Objects.requireNonNull(work, "work cannot be null");

        BackgroundTask<T> task = new BackgroundTask<>(taskIds.incrementAndGet(), description);

        Runnable removeCloseHook;
        try {
            // Tasks still pending when their loop closes are cancelled, like any other cancellation
            removeCloseHook = loop.onClose(() -> {
                if (task.cancel()) {
                    log.debug("{} cancelled because {} closed", task, loop);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Cannot submit background task to {}: {}", loop, e.getMessage());
            throw e;
        }

        tasks.add(task);
        task.future().whenComplete((value, failure) -> {
            tasks.remove(task);
            removeCloseHook.run();
            logOutcome(task, failure);
        });

        try {
            loop.execute(() -> task.start(work, loop));
        } catch (RejectedExecutionException e) {
            log.error("{} rejected {}: {}", loop, task, e.getMessage());
            task.fail(e);
            throw e;
        }
        log.debug("{} submitted to {}", task, loop);
        return task;
    }

    private void logOutcome(BackgroundTask<?> task, Throwable failure) {
        if (failure == null) {
            log.debug("{} completed", task);
        } else if (failure instanceof CancellationException) {
            log.debug("{} cancelled", task);
        } else {
            log.warn("{} failed: {}", task, failure.getMessage(), failure);
        }
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public boolean contains(BackgroundTask<?> task) {
        return tasks.contains(task);
    }

    /**
     * @return A point-in-time copy of the tasks currently retained.
     */
    public List<BackgroundTask<?>> snapshot() {
        return new ArrayList<>(tasks);
    }

    /**
     * Cancels every task still retained. Cancelled tasks leave the registry as usual.
     *
     * @return The number of tasks this call cancelled.
     */
    public int cancelAll() {
        int cancelled = 0;
        for (BackgroundTask<?> task : snapshot()) {
            if (task.cancel()) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} background tasks.", cancelled);
        }
        return cancelled;
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = cancelAll();
        log.debug("BackgroundTaskRegistry shut down, {} tasks cancelled", cancelled);
    }
}

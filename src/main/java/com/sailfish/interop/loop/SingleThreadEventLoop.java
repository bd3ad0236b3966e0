package com.sailfish.interop.loop;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.support.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default {@link EventLoop}. It has no thread of its own: the thread calling
 * {@link #runUntilComplete(AsyncWork)} drives it, and it is closed once that call returns.
 *
 * Callbacks from other threads arrive through a blocking queue; timers live in a priority queue
 * that is only touched by the loop thread.
 */
public class SingleThreadEventLoop implements EventLoop {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private static final AtomicLong LOOP_IDS = new AtomicLong();

    private final String name;
    private final BlockingQueue<Runnable> ready = new LinkedBlockingQueue<>();
    private final PriorityQueue<Timer> timers = new PriorityQueue<>();
    // Guards closing against hook registration and callback submission
    private final Object stateLock = new Object();
    private final Set<Runnable> closeHooks = new LinkedHashSet<>();
    private final AtomicReference<Thread> owner = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private long timerSequence;

    public SingleThreadEventLoop() {
        this("event-loop-" + LOOP_IDS.incrementAndGet());
    }

    public SingleThreadEventLoop(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    @Override
    public <T> T runUntilComplete(AsyncWork<T> work) {
        Objects.requireNonNull(work, "work cannot be null");
        Thread current = Thread.currentThread();
        if (closed.get()) {
            throw new EventLoopException("Event loop " + name + " is closed");
        }
        if (EventLoops.isActiveOnCurrentThread()) {
            throw new EventLoopException("Cannot start event loop " + name
                    + ": another event loop is already running on thread " + current.getName());
        }
        if (!owner.compareAndSet(null, current)) {
            throw new EventLoopException("Event loop " + name + " is already running");
        }

        CompletableFuture<T> outcome = new CompletableFuture<>();
        try {
            EventLoops.bind(this);
            log.debug("Event loop {} started on thread {}", name, current.getName());
            begin(work, outcome);
            pumpUntil(outcome);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EventLoopException("Interrupted while running event loop " + name, ie);
        } finally {
            try {
                teardown();
            } finally {
                EventLoops.unbind(this);
                owner.set(null);
                log.debug("Event loop {} stopped", name);
            }
        }

        Throwable failure = Failures.failureOf(outcome);
        if (failure != null) {
            throw Failures.rethrow(failure);
        }
        return outcome.getNow(null);
    }

    private <T> void begin(AsyncWork<T> work, CompletableFuture<T> outcome) {
        CompletionStage<T> stage;
        try {
            stage = work.start(this);
        } catch (RuntimeException e) {
            outcome.completeExceptionally(e);
            return;
        }
        if (stage == null) {
            outcome.completeExceptionally(new NullPointerException("work returned a null stage"));
            return;
        }
        stage.whenComplete((value, failure) -> {
            // Settle on the loop thread so a completion from another thread wakes the pump
            Runnable settle = () -> {
                if (failure != null) {
                    outcome.completeExceptionally(Failures.unwrap(failure));
                } else {
                    outcome.complete(value);
                }
            };
            if (inEventLoop()) {
                settle.run();
                return;
            }
            try {
                execute(settle);
            } catch (RejectedExecutionException closedAlready) {
                // Nobody is pumping any more; settle in place
                settle.run();
            }
        });
    }

    private void pumpUntil(CompletableFuture<?> outcome) throws InterruptedException {
        while (!outcome.isDone()) {
            runDueTimers();
            if (outcome.isDone()) {
                break;
            }
            Runnable next;
            Timer earliest = timers.peek();
            if (earliest == null) {
                next = ready.take();
            } else {
                long wait = earliest.deadline - System.nanoTime();
                next = wait <= 0 ? ready.poll() : ready.poll(wait, TimeUnit.NANOSECONDS);
            }
            if (next != null) {
                runSafely(next);
            }
        }
    }

    private void runDueTimers() {
        long now = System.nanoTime();
        while (!timers.isEmpty() && timers.peek().deadline - now <= 0) {
            runSafely(timers.poll().task);
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Callback failed on event loop {}: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task cannot be null");
        synchronized (stateLock) {
            if (closed.get()) {
                throw new RejectedExecutionException("Event loop " + name + " is closed");
            }
            ready.add(task);
        }
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task cannot be null");
        Objects.requireNonNull(delay, "delay cannot be null");
        long deadline = System.nanoTime() + delay.toNanos();
        if (inEventLoop()) {
            if (closed.get()) {
                throw new RejectedExecutionException("Event loop " + name + " is closed");
            }
            timers.add(new Timer(deadline, timerSequence++, task));
        } else {
            execute(() -> timers.add(new Timer(deadline, timerSequence++, task)));
        }
    }

    @Override
    public boolean inEventLoop() {
        return owner.get() == Thread.currentThread();
    }

    @Override
    public boolean isRunning() {
        return owner.get() != null;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public Runnable onClose(Runnable hook) {
        Objects.requireNonNull(hook, "hook cannot be null");
        synchronized (stateLock) {
            if (closed.get()) {
                throw new RejectedExecutionException("Event loop " + name + " is closed");
            }
            closeHooks.add(hook);
        }
        return () -> {
            synchronized (stateLock) {
                closeHooks.remove(hook);
            }
        };
    }

    @Override
    public void close() {
        if (isRunning()) {
            throw new EventLoopException("Cannot close event loop " + name + " while it is running");
        }
        teardown();
    }

    private void teardown() {
        List<Runnable> hooks;
        synchronized (stateLock) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            // No hook can be added after this point, so every registered hook runs below
            hooks = new ArrayList<>(closeHooks);
            closeHooks.clear();
        }
        for (Runnable hook : hooks) {
            runSafely(hook);
        }
        int discarded = ready.size() + timers.size();
        ready.clear();
        timers.clear();
        if (discarded > 0) {
            log.debug("Event loop {} closed, {} pending callbacks discarded", name, discarded);
        }
    }

    @Override
    public String toString() {
        return "SingleThreadEventLoop[" + name + "]";
    }

    private static final class Timer implements Comparable<Timer> {

        final long deadline;
        final long sequence;
        final Runnable task;

        Timer(long deadline, long sequence, Runnable task) {
            this.deadline = deadline;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public int compareTo(Timer other) {
            int byDeadline = Long.compare(deadline - other.deadline, 0);
            return byDeadline != 0 ? byDeadline : Long.compare(sequence, other.sequence);
        }
    }
}

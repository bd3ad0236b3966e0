package com.sailfish.interop.bridge.impl;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.bridge.AmbientLoopProbe;
import com.sailfish.interop.bridge.AmbientLoopState;
import com.sailfish.interop.bridge.SchedulerBridge;
import com.sailfish.interop.loop.EventLoop;
import com.sailfish.interop.loop.EventLoopException;
import com.sailfish.interop.loop.EventLoopFactory;
import com.sailfish.interop.loop.EventLoops;
import com.sailfish.interop.loop.SingleThreadEventLoop;
import com.sailfish.interop.support.ExecutorShutdown;
import com.sailfish.interop.support.Failures;
import com.sailfish.interop.support.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of the SchedulerBridge.
 *
 * Every call either runs inline on a loop created for it, or on a single-thread executor created
 * for it; either way the loop is closed and the thread joined before the call returns.
 */
public class DefaultSchedulerBridge implements SchedulerBridge {

    private static final Logger log = LoggerFactory.getLogger(DefaultSchedulerBridge.class);

    // Default configuration values
    public static final long DEFAULT_JOIN_TIMEOUT_SECONDS = 30;

    private final EventLoopFactory loopFactory;
    private final AmbientLoopProbe probe;
    private final ThreadFactory isolatedThreads;
    private final long joinTimeoutSeconds;

    public DefaultSchedulerBridge() {
        this(SingleThreadEventLoop::new, EventLoops::isActiveOnCurrentThread);
    }

    public DefaultSchedulerBridge(EventLoopFactory loopFactory, AmbientLoopProbe probe) {
        this(loopFactory, probe, new NamedThreadFactory("interop-bridge"), DEFAULT_JOIN_TIMEOUT_SECONDS);
    }

    /**
     * @param loopFactory        Creates the loop each call runs on.
     * @param probe              Tells whether a loop is already running on the calling thread.
     * @param isolatedThreads    Creates the isolated thread used when one is.
     * @param joinTimeoutSeconds How long to wait for the isolated thread to terminate before forcing it.
     */
    public DefaultSchedulerBridge(EventLoopFactory loopFactory,
                                  AmbientLoopProbe probe,
                                  ThreadFactory isolatedThreads,
                                  long joinTimeoutSeconds) {
        this.loopFactory = Objects.requireNonNull(loopFactory, "loopFactory cannot be null");
        this.probe = Objects.requireNonNull(probe, "probe cannot be null");
        this.isolatedThreads = Objects.requireNonNull(isolatedThreads, "isolatedThreads cannot be null");
        if (joinTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("joinTimeoutSeconds must be positive");
        }
        this.joinTimeoutSeconds = joinTimeoutSeconds;
        log.debug("SchedulerBridge initialized with joinTimeoutSeconds={}", joinTimeoutSeconds);
    }

    @Override
    public <T> T runToCompletion(AsyncWork<T> work) {
        Objects.requireNonNull(work, "work cannot be null");
        AmbientLoopState state = detect();
        log.debug("Running work to completion on thread {}; ambient loop: {}",
                Thread.currentThread().getName(), state);
        if (state == AmbientLoopState.ACTIVE_ON_CURRENT_THREAD) {
            return runIsolated(work);
        }
        return runInline(work);
    }

    /**
     * Asks the probe about the calling thread. A probe failure is treated as "no loop".
     */
    public AmbientLoopState detect() {
        try {
            return probe.isLoopActiveOnCurrentThread()
                    ? AmbientLoopState.ACTIVE_ON_CURRENT_THREAD
                    : AmbientLoopState.NONE;
        } catch (RuntimeException e) {
            log.debug("Could not determine the ambient event loop, assuming none: {}", e.getMessage(), e);
            return AmbientLoopState.NONE;
        }
    }

    private <T> T runInline(AsyncWork<T> work) {
        EventLoop loop = newLoop();
        try {
            return loop.runUntilComplete(work);
        } finally {
            if (!loop.isClosed() && !loop.isRunning()) {
                loop.close();
            }
        }
    }

    private EventLoop newLoop() {
        EventLoop loop;
        try {
            loop = loopFactory.create();
        } catch (EventLoopException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventLoopException("Failed to create event loop: " + e.getMessage(), e);
        }
        if (loop == null) {
            throw new EventLoopException("Event loop factory returned null");
        }
        return loop;
    }

    private <T> T runIsolated(AsyncWork<T> work) {
        ExecutorService isolated = Executors.newSingleThreadExecutor(isolatedThreads);
        try {
            Future<T> outcome;
            try {
                outcome = isolated.submit(() -> runInline(work));
            } catch (RuntimeException e) {
                throw new EventLoopException("Failed to start isolated event loop thread: " + e.getMessage(), e);
            }
            return await(outcome);
        } finally {
            if (!ExecutorShutdown.join("Isolated event loop thread", isolated, joinTimeoutSeconds, TimeUnit.SECONDS)) {
                log.error("Isolated event loop thread could not be reclaimed.");
            }
        }
    }

    private <T> T await(Future<T> outcome) {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            // The isolated thread already surfaced the work's failure; only the executor's layer is removed
            throw Failures.rethrow(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException ie) {
            outcome.cancel(true);
            Thread.currentThread().interrupt();
            throw new EventLoopException("Interrupted while waiting for isolated event loop", ie);
        }
    }
}

package com.sailfish.interop.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Reclaims the threads of an executor: a graceful shutdown first, then a forced one when the
 * running work does not finish in time.
 */
public final class ExecutorShutdown {

    private static final Logger log = LoggerFactory.getLogger(ExecutorShutdown.class);

    private ExecutorShutdown() {
    }

    /**
     * Shuts the executor down and waits for its threads to terminate.
     *
     * @param name     Name used in log messages.
     * @param executor The executor to reclaim.
     * @param timeout  How long to wait in each phase.
     * @param unit     Unit of {@code timeout}.
     * @return true if the executor terminated.
     */
    public static boolean shutdown(String name, ExecutorService executor, long timeout, TimeUnit unit) {
        log.debug("Shutting down {}...", name);
        executor.shutdown(); // Disable new work from being submitted
        try {
            if (executor.awaitTermination(timeout, unit)) {
                log.debug("{} terminated gracefully.", name);
                return true;
            }
            log.warn("{} did not terminate in {} {}.", name, timeout, unit);
            List<Runnable> dropped = executor.shutdownNow(); // Interrupt work still running
            log.warn("Forcefully shutting down {}. {} queued jobs were dropped.", name, dropped.size());
            if (!executor.awaitTermination(timeout, unit)) {
                log.error("{} did not terminate even after forceful shutdown.", name);
                return false;
            }
            return true;
        } catch (InterruptedException ie) {
            log.warn("{} shutdown interrupted. Forcing shutdown now.", name);
            executor.shutdownNow();
            // Preserve interrupt status
            Thread.currentThread().interrupt();
            return executor.isTerminated();
        }
    }

    /**
     * Shuts the executor down and waits for its threads to terminate even if the calling thread is
     * interrupted meanwhile. An interrupt forces the shutdown and is re-asserted before returning.
     *
     * @return true if the executor terminated.
     */
    public static boolean join(String name, ExecutorService executor, long timeout, TimeUnit unit) {
        executor.shutdown();
        boolean interrupted = false;
        boolean forced = false;
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    if (forced) {
                        log.error("{} did not terminate even after forceful shutdown.", name);
                        return false;
                    }
                    log.warn("{} did not terminate in {} {}. Forcing shutdown now.", name, timeout, unit);
                    executor.shutdownNow();
                    forced = true;
                    deadline = System.nanoTime() + unit.toNanos(timeout);
                    continue;
                }
                try {
                    if (executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                        return true;
                    }
                } catch (InterruptedException ie) {
                    interrupted = true;
                    if (!forced) {
                        executor.shutdownNow();
                        forced = true;
                    }
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}

package com.sailfish.interop.offload.impl;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.loop.EventLoop;
import com.sailfish.interop.offload.BlockingCallOffloader;
import com.sailfish.interop.support.ExecutorShutdown;
import com.sailfish.interop.support.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of the BlockingCallOffloader, backed by an {@link ExecutorService}.
 *
 * The pool bounds how many calls run in parallel; calls beyond the bound queue up instead of
 * being rejected. Results are handed back to the awaiting loop with {@link EventLoop#execute}.
 */
public class ExecutorBlockingCallOffloader implements BlockingCallOffloader {

    private static final Logger log = LoggerFactory.getLogger(ExecutorBlockingCallOffloader.class);

    // Default configuration values
    public static final int DEFAULT_POOL_SIZE = Math.min(32, Runtime.getRuntime().availableProcessors() + 4);
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final long IDLE_KEEP_ALIVE_SECONDS = 60;

    private final ExecutorService workerPool;

    /**
     * Creates an offloader with its own pool of {@link #DEFAULT_POOL_SIZE} daemon threads.
     */
    public ExecutorBlockingCallOffloader() {
        this(DEFAULT_POOL_SIZE);
    }

    /**
     * Creates an offloader with its own pool of daemon threads.
     *
     * @param poolSize Maximum number of blocking calls running at the same time.
     */
    public ExecutorBlockingCallOffloader(int poolSize) {
        this(newBoundedPool(poolSize));
        log.info("BlockingCallOffloader initialized with poolSize={}", poolSize);
    }

    /**
     * Creates an offloader running calls on the given executor. The offloader takes ownership of it.
     */
    public ExecutorBlockingCallOffloader(ExecutorService workerPool) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool cannot be null");
    }

    private static ExecutorService newBoundedPool(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        ThreadPoolExecutor pool = new ThreadPoolExecutor(poolSize, poolSize,
                IDLE_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("blocking-call"));
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    @Override
    public <T> AsyncWork<T> runBlocking(Callable<T> call) {
        Objects.requireNonNull(call, "call cannot be null");
        return loop -> submit(loop, call);
    }

    private <T> CompletableFuture<T> submit(EventLoop loop, Callable<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            workerPool.execute(() -> {
                T value;
                try {
                    value = call.call();
                } catch (Throwable failure) {
                    deliver(loop, () -> result.completeExceptionally(failure));
                    return;
                }
                deliver(loop, () -> result.complete(value));
            });
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected a blocking call: {}", e.getMessage());
            result.completeExceptionally(e);
        }
        return result;
    }

    private void deliver(EventLoop loop, Runnable completion) {
        try {
            loop.execute(completion);
        } catch (RejectedExecutionException e) {
            log.warn("Blocking call finished after {} closed; its outcome is discarded.", loop);
        }
    }

    /**
     * Shuts the pool down, waiting up to {@link #DEFAULT_SHUTDOWN_TIMEOUT_SECONDS} for running calls.
     */
    @PreDestroy
    public void shutdown() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    @Override
    public void shutdown(long timeoutSeconds) {
        ExecutorShutdown.shutdown("Blocking call pool", workerPool, timeoutSeconds, TimeUnit.SECONDS);
    }
}

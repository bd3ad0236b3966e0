package com.sailfish.interop;

import com.sailfish.interop.bridge.SchedulerBridge;
import com.sailfish.interop.bridge.impl.DefaultSchedulerBridge;
import com.sailfish.interop.offload.BlockingCallOffloader;
import com.sailfish.interop.offload.BlockingFunction;
import com.sailfish.interop.offload.impl.ExecutorBlockingCallOffloader;
import com.sailfish.interop.task.BackgroundTask;
import com.sailfish.interop.task.BackgroundTaskRegistry;
import com.sailfish.interop.twin.SyncTwins;

import java.util.concurrent.Callable;

/**
 * Process-wide entry points, backed by lazily created default components.
 *
 * <pre>
 * // blocking code calling scheduled code
 * int answer = AsyncUtils.runSync(AsyncWork.completed(41).map(x -&gt; x + 1));
 *
 * // scheduled code calling blocking code
 * AsyncWork&lt;String&gt; page = AsyncUtils.runAsync(() -&gt; download(url));
 *
 * // fire and forget from scheduled code
 * AsyncUtils.createTask(refreshCache());
 * </pre>
 *
 * Applications that manage their own components should construct them directly instead.
 */
public final class AsyncUtils {

    private AsyncUtils() {
    }

    // Initialized on first use
    private static final class Defaults {
        static final SchedulerBridge BRIDGE = new DefaultSchedulerBridge();
        static final BlockingCallOffloader OFFLOADER = new ExecutorBlockingCallOffloader();
        static final SyncTwins TWINS = new SyncTwins(BRIDGE);
    }

    /**
     * Starts the work in the background on the event loop running on the calling thread. The task is
     * retained by {@link BackgroundTaskRegistry#global()} until it finishes.
     *
     * @throws IllegalStateException if no event loop is running on this thread.
     */
    public static <T> BackgroundTask<T> createTask(AsyncWork<T> work) {
        return BackgroundTaskRegistry.global().submit(work);
    }

    /**
     * Runs a blocking call on the shared worker pool; see {@link BlockingCallOffloader#runBlocking(Callable)}.
     */
    public static <T> AsyncWork<T> runAsync(Callable<T> call) {
        return Defaults.OFFLOADER.runBlocking(call);
    }

    public static <A, T> AsyncWork<T> runAsync(BlockingFunction<? super A, ? extends T> function, A argument) {
        return Defaults.OFFLOADER.runBlocking(function, argument);
    }

    /**
     * Runs the work to completion from blocking code; see {@link SchedulerBridge#runToCompletion(AsyncWork)}.
     */
    public static <T> T runSync(AsyncWork<T> work) {
        return Defaults.BRIDGE.runToCompletion(work);
    }

    /**
     * @return The twin exposer bound to the shared bridge.
     */
    public static SyncTwins syncTwins() {
        return Defaults.TWINS;
    }

    public static BackgroundTaskRegistry backgroundTasks() {
        return BackgroundTaskRegistry.global();
    }
}

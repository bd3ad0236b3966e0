package com.sailfish.interop.loop;

import java.util.Optional;

/**
 * Tracks which event loop, if any, is running on each thread.
 */
public final class EventLoops {

    private static final ThreadLocal<EventLoop> CURRENT = new ThreadLocal<>();

    private EventLoops() {
    }

    /**
     * @return The loop running on the calling thread, or empty if there is none.
     */
    public static Optional<EventLoop> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static boolean isActiveOnCurrentThread() {
        return CURRENT.get() != null;
    }

    /**
     * Marks the loop as running on the calling thread. For use by {@link EventLoop} implementations.
     *
     * @throws EventLoopException if another loop is already running on this thread.
     */
    public static void bind(EventLoop loop) {
        EventLoop existing = CURRENT.get();
        if (existing != null && existing != loop) {
            throw new EventLoopException("Another event loop is already running on thread "
                    + Thread.currentThread().getName());
        }
        CURRENT.set(loop);
    }

    /**
     * Clears the calling thread's binding if it belongs to the given loop.
     */
    public static void unbind(EventLoop loop) {
        if (CURRENT.get() == loop) {
            CURRENT.remove();
        }
    }
}

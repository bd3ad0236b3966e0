package com.sailfish.interop.bridge;

/**
 * Whether an event loop is running on the thread calling into the bridge.
 */
public enum AmbientLoopState {
    /**
     * No loop on this thread; the work can run inline on a fresh loop.
     */
    NONE,
    /**
     * A loop is running on this thread; the work must run on an isolated thread.
     */
    ACTIVE_ON_CURRENT_THREAD
}

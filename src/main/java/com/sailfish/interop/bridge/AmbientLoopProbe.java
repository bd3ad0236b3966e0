package com.sailfish.interop.bridge;

/**
 * Query supplied by the host runtime telling whether one of its loops is running on the calling thread.
 */
@FunctionalInterface
public interface AmbientLoopProbe {

    boolean isLoopActiveOnCurrentThread();
}

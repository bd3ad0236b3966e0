package com.sailfish.interop.loop;

/**
 * Creates fresh, not yet running event loops.
 */
@FunctionalInterface
public interface EventLoopFactory {

    EventLoop create();
}

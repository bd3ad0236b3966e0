package com.sailfish.interop.twin;

import com.sailfish.interop.AsyncWork;

/**
 * A scheduled method taking two arguments.
 */
@FunctionalInterface
public interface ScheduledCall2<A, P1, P2, R> {

    AsyncWork<R> open(A target, P1 first, P2 second);
}

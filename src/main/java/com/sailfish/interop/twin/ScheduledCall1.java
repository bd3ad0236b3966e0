package com.sailfish.interop.twin;

import com.sailfish.interop.AsyncWork;

/**
 * A scheduled method taking one argument.
 */
@FunctionalInterface
public interface ScheduledCall1<A, P, R> {

    AsyncWork<R> open(A target, P argument);
}

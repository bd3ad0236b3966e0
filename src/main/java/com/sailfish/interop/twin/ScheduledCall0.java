package com.sailfish.interop.twin;

import com.sailfish.interop.AsyncWork;

/**
 * A scheduled method without arguments, usually given as a method reference such as
 * {@code Cache::refreshAsync}.
 *
 * @param <A> The type declaring the method.
 * @param <R> The result type of the method's work.
 */
@FunctionalInterface
public interface ScheduledCall0<A, R> {

    AsyncWork<R> open(A target);
}

package com.sailfish.interop.offload;

/**
 * A blocking function of one argument that may throw.
 *
 * @param <A> The argument type.
 * @param <R> The result type.
 */
@FunctionalInterface
public interface BlockingFunction<A, R> {

    R apply(A argument) throws Exception;
}

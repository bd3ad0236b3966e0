package com.sailfish.interop.twin;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.bridge.SchedulerBridge;

import java.util.Objects;

/**
 * Runs the blocking twins registered in a {@link SyncTwinTable}. Each twin call obtains the unit of work
 * from the scheduled method and runs it to completion through the {@link SchedulerBridge}.
 */
public class SyncTwins {

    private static final Object[] NO_ARGS = new Object[0];

    private final SchedulerBridge bridge;

    public SyncTwins(SchedulerBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge cannot be null");
    }

    /**
     * Calls the named twin, blocking until its scheduled method's work completes.
     *
     * @param instance The object declaring the scheduled method.
     * @param table    The twins registered for the instance's type.
     * @param twinName The registered twin name.
     * @param args     Arguments for the scheduled method.
     * @param <R>      The expected result type; not checked.
     * @return The result of the work.
     * @throws IllegalArgumentException if no twin, or more than one, accepts the arguments.
     */
    @SuppressWarnings("unchecked")
    public <A, R> R call(A instance, SyncTwinTable<A> table, String twinName, Object... args) {
        Objects.requireNonNull(instance, "instance cannot be null");
        Objects.requireNonNull(table, "table cannot be null");
        Objects.requireNonNull(twinName, "twinName cannot be null");
        Object[] actual = args == null ? NO_ARGS : args;
        SyncTwin<A> twin = table.resolve(twinName, actual);
        AsyncWork<?> work = twin.open(instance, actual);
        return (R) bridge.runToCompletion(work);
    }

    /**
     * @return The twins of the table, bound to one instance.
     * @throws IllegalArgumentException if the instance is not of the table's type.
     */
    public <A> BoundTwins<A> bind(A instance, SyncTwinTable<A> table) {
        Objects.requireNonNull(instance, "instance cannot be null");
        Objects.requireNonNull(table, "table cannot be null");
        if (!table.getType().isInstance(instance)) {
            throw new IllegalArgumentException(instance.getClass().getName() + " is not a " + table.getType().getName());
        }
        return new BoundTwins<>(this, instance, table);
    }
}

package com.sailfish.interop.twin;

import com.sailfish.interop.WorkFailedException;

import java.util.Objects;

/**
 * The blocking twins of one instance. Callers usually wrap this in a small blocking facade of their own.
 *
 * @param <A> The type declaring the scheduled methods.
 */
public final class BoundTwins<A> {

    private final SyncTwins twins;
    private final A instance;
    private final SyncTwinTable<A> table;

    BoundTwins(SyncTwins twins, A instance, SyncTwinTable<A> table) {
        this.twins = twins;
        this.instance = instance;
        this.table = table;
    }

    /**
     * Calls the named twin. The result may be null when the work completes with null.
     */
    public <R> R call(String twinName, Object... args) {
        return twins.call(instance, table, twinName, args);
    }

    /**
     * Calls the named twin for a result that is unboxed by the caller.
     *
     * @throws IllegalStateException if the work completes with null.
     */
    public <R> R callNonNull(String twinName, Object... args) {
        R result = call(twinName, args);
        if (result == null) {
            throw new IllegalStateException("Sync twin '" + twinName + "' of " + table.getType().getName()
                    + " completed with null where a value is required");
        }
        return result;
    }

    /**
     * Calls the named twin, rethrowing a checked failure of the declared type as itself instead of
     * wrapped in {@link WorkFailedException}.
     */
    public <R, X extends Exception> R callChecked(Class<X> declared, String twinName, Object... args) throws X {
        Objects.requireNonNull(declared, "declared cannot be null");
        try {
            return call(twinName, args);
        } catch (WorkFailedException e) {
            if (declared.isInstance(e.getCause())) {
                throw declared.cast(e.getCause());
            }
            throw e;
        }
    }

    public A getInstance() {
        return instance;
    }

    public SyncTwinTable<A> getTable() {
        return table;
    }

    @Override
    public String toString() {
        return "BoundTwins[" + table.getType().getSimpleName() + " twins of " + instance + "]";
    }
}

package com.sailfish.interop.twin;

import com.sailfish.interop.AsyncWork;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A registered blocking twin: its name, the parameter types it accepts, and the scheduled method
 * that produces its work.
 *
 * @param <A> The type declaring the scheduled method.
 */
public final class SyncTwin<A> {

    /**
     * Adapts a typed scheduled call to an argument array already checked against the parameter types.
     */
    @FunctionalInterface
    interface Opener<A> {
        AsyncWork<?> open(A target, Object[] args);
    }

    private final String name;
    private final Class<A> declaringType;
    private final List<Class<?>> parameterTypes;
    private final Opener<A> opener;

    SyncTwin(String name, Class<A> declaringType, List<Class<?>> parameterTypes, Opener<A> opener) {
        this.name = name;
        this.declaringType = declaringType;
        this.parameterTypes = List.copyOf(parameterTypes);
        this.opener = opener;
    }

    public String getName() {
        return name;
    }

    public List<Class<?>> getParameterTypes() {
        return parameterTypes;
    }

    public int getArity() {
        return parameterTypes.size();
    }

    /**
     * @return true if a call with these arguments reaches this twin. Null matches any parameter.
     */
    public boolean accepts(Object[] args) {
        if (args.length != parameterTypes.size()) {
            return false;
        }
        for (int i = 0; i < args.length; i++) {
            if (args[i] != null && !parameterTypes.get(i).isInstance(args[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Calls the scheduled method to obtain its unit of work. The work is not started.
     *
     * @throws IllegalArgumentException if the target or the arguments do not fit this twin.
     */
    AsyncWork<?> open(Object target, Object[] args) {
        if (!declaringType.isInstance(target)) {
            throw new IllegalArgumentException("Twin " + describe() + " cannot be called on "
                    + (target == null ? "null" : target.getClass().getName()));
        }
        if (!accepts(args)) {
            throw new IllegalArgumentException("Twin " + describe() + " does not accept the given arguments");
        }
        AsyncWork<?> work = opener.open(declaringType.cast(target), args);
        if (work == null) {
            throw new IllegalStateException("Scheduled method of twin " + describe() + " returned null instead of work");
        }
        return work;
    }

    String signature() {
        return parameterTypes.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", name + "(", ")"));
    }

    String describe() {
        return "'" + signature() + "' of " + declaringType.getName();
    }

    @Override
    public String toString() {
        return "SyncTwin[" + signature() + " on " + declaringType.getSimpleName() + "]";
    }
}

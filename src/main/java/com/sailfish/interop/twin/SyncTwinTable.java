package com.sailfish.interop.twin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The blocking twins of a type, registered once through a {@link Builder} and immutable afterwards.
 *
 * A twin is identified by its name and parameter types, so twins may be overloaded. Registering the
 * same name with the same parameter types twice is rejected.
 *
 * @param <A> The type declaring the scheduled methods.
 */
public final class SyncTwinTable<A> {

    private static final Logger log = LoggerFactory.getLogger(SyncTwinTable.class);

    private final Class<A> type;
    private final Map<String, List<SyncTwin<A>>> twinsByName;

    private SyncTwinTable(Class<A> type, Map<String, List<SyncTwin<A>>> twinsByName) {
        this.type = type;
        this.twinsByName = twinsByName;
    }

    public static <A> Builder<A> builder(Class<A> type) {
        return new Builder<>(type);
    }

    public Class<A> getType() {
        return type;
    }

    /**
     * @return The registered twin names, sorted.
     */
    public Set<String> twinNames() {
        return Collections.unmodifiableSet(new TreeSet<>(twinsByName.keySet()));
    }

    public List<SyncTwin<A>> twins(String twinName) {
        return twinsByName.getOrDefault(twinName, Collections.emptyList());
    }

    /**
     * @return The twin with exactly these parameter types.
     */
    public Optional<SyncTwin<A>> find(String twinName, Class<?>... parameterTypes) {
        List<Class<?>> wanted = Arrays.asList(parameterTypes);
        for (SyncTwin<A> twin : twins(twinName)) {
            if (twin.getParameterTypes().equals(wanted)) {
                return Optional.of(twin);
            }
        }
        return Optional.empty();
    }

    /**
     * Picks the twin a call with these arguments would reach.
     *
     * @throws IllegalArgumentException if no twin, or more than one, accepts the arguments.
     */
    public SyncTwin<A> resolve(String twinName, Object... args) {
        Object[] actual = args == null ? new Object[0] : args;
        List<SyncTwin<A>> candidates = twins(twinName);
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No sync twin named '" + twinName + "' on " + type.getName());
        }
        SyncTwin<A> match = null;
        for (SyncTwin<A> candidate : candidates) {
            if (candidate.accepts(actual)) {
                if (match != null) {
                    throw new IllegalArgumentException("Call to sync twin '" + twinName + "' on " + type.getName()
                            + " is ambiguous between " + match.signature() + " and " + candidate.signature());
                }
                match = candidate;
            }
        }
        if (match == null) {
            throw new IllegalArgumentException("No sync twin '" + twinName + "' on " + type.getName()
                    + " accepts " + actual.length + " arguments of the given types");
        }
        return match;
    }

    @Override
    public String toString() {
        return "SyncTwinTable[" + type.getName() + ", twins=" + twinNames() + "]";
    }

    /**
     * Collects the twins of a type. Should be used once, where the type is defined.
     */
    public static final class Builder<A> {

        private final Class<A> type;
        private final Map<String, List<SyncTwin<A>>> twins = new LinkedHashMap<>();

        private Builder(Class<A> type) {
            this.type = Objects.requireNonNull(type, "type cannot be null");
        }

        public <R> Builder<A> twin(String name, ScheduledCall0<A, R> call) {
            Objects.requireNonNull(call, "call cannot be null");
            return add(name, Collections.emptyList(), (target, args) -> call.open(target));
        }

        /**
         * Registers a twin of a one-argument scheduled method.
         *
         * @param name          The twin name.
         * @param parameterType The argument type, boxed for primitive parameters.
         * @param call          The scheduled method, usually a method reference.
         */
        public <P, R> Builder<A> twin(String name, Class<P> parameterType, ScheduledCall1<A, P, R> call) {
            Objects.requireNonNull(call, "call cannot be null");
            return add(name, List.of(checkParameterType(name, parameterType)),
                    (target, args) -> call.open(target, parameterType.cast(args[0])));
        }

        public <P1, P2, R> Builder<A> twin(String name, Class<P1> firstType, Class<P2> secondType,
                                           ScheduledCall2<A, P1, P2, R> call) {
            Objects.requireNonNull(call, "call cannot be null");
            return add(name, List.of(checkParameterType(name, firstType), checkParameterType(name, secondType)),
                    (target, args) -> call.open(target, firstType.cast(args[0]), secondType.cast(args[1])));
        }

        private Class<?> checkParameterType(String name, Class<?> parameterType) {
            Objects.requireNonNull(parameterType, "parameterType cannot be null");
            if (parameterType.isPrimitive()) {
                throw new SyncTwinDeclarationException("Twin '" + name + "' of " + type.getName()
                        + " declares primitive parameter type " + parameterType + "; use its wrapper class");
            }
            return parameterType;
        }

        private Builder<A> add(String name, List<Class<?>> parameterTypes, SyncTwin.Opener<A> opener) {
            validateName(name);
            SyncTwin<A> twin = new SyncTwin<>(name, type, parameterTypes, opener);
            List<SyncTwin<A>> sameName = twins.computeIfAbsent(name, key -> new ArrayList<>());
            for (SyncTwin<A> existing : sameName) {
                if (existing.getParameterTypes().equals(twin.getParameterTypes())) {
                    throw new SyncTwinDeclarationException("Twin '" + twin.signature() + "' of " + type.getName()
                            + " is registered twice");
                }
            }
            sameName.add(twin);
            log.info("Registering sync twin '{}' for {}", twin.signature(), type.getName());
            return this;
        }

        private void validateName(String name) {
            if (name == null || name.trim().isEmpty()) {
                throw new SyncTwinDeclarationException("Blank twin name on " + type.getName());
            }
            if (!Character.isJavaIdentifierStart(name.charAt(0))) {
                throw new SyncTwinDeclarationException("Twin name '" + name + "' on " + type.getName()
                        + " is not a valid method name");
            }
            for (int i = 1; i < name.length(); i++) {
                if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                    throw new SyncTwinDeclarationException("Twin name '" + name + "' on " + type.getName()
                            + " is not a valid method name");
                }
            }
        }

        public SyncTwinTable<A> build() {
            Map<String, List<SyncTwin<A>>> byName = new LinkedHashMap<>();
            twins.forEach((name, registered) -> byName.put(name, List.copyOf(registered)));
            log.debug("Built sync twin table for {} with twins {}", type.getName(), byName.keySet());
            return new SyncTwinTable<>(type, Collections.unmodifiableMap(byName));
        }
    }
}

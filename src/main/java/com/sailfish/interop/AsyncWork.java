package com.sailfish.interop;

import com.sailfish.interop.loop.EventLoop;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Represents a unit of work that runs cooperatively on an {@link EventLoop}.
 * Implementations must not block the loop thread; anything blocking should be
 * offloaded and awaited through the returned stage.
 *
 * @param <T> The type of the value produced by the work.
 */
@FunctionalInterface
public interface AsyncWork<T> {

    /**
     * Begins the work on the given loop. Called on the loop thread.
     *
     * @param loop The loop driving this work.
     * @return A stage completing with the work's result or failure.
     */
    CompletionStage<T> start(EventLoop loop);

    /**
     * Transforms the result of this work once it completes.
     */
    default <R> AsyncWork<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return loop -> start(loop).thenApply(mapper);
    }

    /**
     * Continues with further work once this work completes.
     */
    default <R> AsyncWork<R> flatMap(Function<? super T, ? extends AsyncWork<R>> next) {
        Objects.requireNonNull(next, "next cannot be null");
        return loop -> start(loop).thenCompose(value -> next.apply(value).start(loop));
    }

    static <T> AsyncWork<T> completed(T value) {
        return loop -> CompletableFuture.completedFuture(value);
    }

    static <T> AsyncWork<T> failed(Throwable error) {
        Objects.requireNonNull(error, "error cannot be null");
        return loop -> CompletableFuture.failedFuture(error);
    }

    /**
     * Suspends for the given delay using the loop's timer, leaving the loop free to run other work.
     */
    static AsyncWork<Void> sleep(Duration delay) {
        Objects.requireNonNull(delay, "delay cannot be null");
        return loop -> {
            CompletableFuture<Void> done = new CompletableFuture<>();
            loop.schedule(() -> done.complete(null), delay);
            return done;
        };
    }

    /**
     * Starts every piece of work concurrently and completes with their results in the given order.
     * Fails with the first failure observed.
     */
    static <T> AsyncWork<List<T>> all(List<? extends AsyncWork<? extends T>> works) {
        Objects.requireNonNull(works, "works cannot be null");
        return loop -> {
            List<CompletableFuture<? extends T>> started = new ArrayList<>(works.size());
            for (AsyncWork<? extends T> work : works) {
                started.add(work.start(loop).toCompletableFuture());
            }
            return CompletableFuture.allOf(started.toArray(new CompletableFuture<?>[0]))
                    .thenApply(ignored -> {
                        List<T> results = new ArrayList<>(started.size());
                        for (CompletableFuture<? extends T> future : started) {
                            results.add(future.join());
                        }
                        return Collections.unmodifiableList(results);
                    });
        };
    }
}

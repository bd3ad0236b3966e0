package com.sailfish.interop.offload.impl;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.WorkFailedException;
import com.sailfish.interop.bridge.impl.DefaultSchedulerBridge;
import com.sailfish.interop.loop.SingleThreadEventLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class ExecutorBlockingCallOffloaderTest {

    private ExecutorBlockingCallOffloader offloader;

    @BeforeEach
    void setUp() {
        offloader = new ExecutorBlockingCallOffloader(4);
    }

    @AfterEach
    void tearDown() {
        offloader.shutdown(1);
    }

    @Test
    void shouldRunCallOnWorkerThread() {
        String loopThread = Thread.currentThread().getName();

        String workerThread = new SingleThreadEventLoop().runUntilComplete(
                offloader.runBlocking(() -> Thread.currentThread().getName()));

        assertThat(workerThread).startsWith("blocking-call-").isNotEqualTo(loopThread);
    }

    @Test
    void shouldCompleteOnLoopThread() {
        Thread caller = Thread.currentThread();
        AtomicReference<Thread> resumedOn = new AtomicReference<>();

        new SingleThreadEventLoop().runUntilComplete(offloader.runBlocking(() -> "value")
                .map(value -> {
                    resumedOn.set(Thread.currentThread());
                    return value;
                }));

        assertThat(resumedOn.get()).isSameAs(caller);
    }

    @Test
    void shouldBindArgumentToFunction() {
        Integer length = new SingleThreadEventLoop().runUntilComplete(offloader.runBlocking(String::length, "hello"));

        assertThat(length).isEqualTo(5);
    }

    @Test
    void shouldDeliverFailureUnmodifiedToAwaitingWork() {
        IllegalArgumentException boom = new IllegalArgumentException("boom");

        Throwable seen = new SingleThreadEventLoop().runUntilComplete(loop ->
                offloader.runBlocking(() -> {
                    throw boom;
                }).start(loop).handle((value, failure) -> failure));

        assertThat(seen).isSameAs(boom);
    }

    @Test
    void shouldDeliverFailureUnmodifiedThroughBridge() {
        IllegalArgumentException boom = new IllegalArgumentException("boom");

        assertThatThrownBy(() -> new DefaultSchedulerBridge().runToCompletion(offloader.runBlocking(() -> {
            throw boom;
        }))).isSameAs(boom);
    }

    @Test
    void shouldWrapCheckedFailureForBlockingCaller() {
        IOException io = new IOException("disk gone");

        assertThatThrownBy(() -> new SingleThreadEventLoop().runUntilComplete(offloader.runBlocking(() -> {
            throw io;
        }))).isInstanceOf(WorkFailedException.class).hasCause(io);
    }

    @Test
    @DisplayName("a blocking call does not stall other work on the loop")
    void shouldKeepLoopResponsiveWhileCallBlocks() {
        CountDownLatch released = new CountDownLatch(1);
        AsyncWork<String> blocked = offloader.runBlocking(() ->
                released.await(5, TimeUnit.SECONDS) ? "released" : "timed out");
        AsyncWork<String> releaser = AsyncWork.sleep(Duration.ofMillis(20)).map(v -> {
            released.countDown();
            return "released it";
        });
        List<AsyncWork<String>> works = List.of(blocked, releaser);

        List<String> results = new SingleThreadEventLoop().runUntilComplete(AsyncWork.all(works));

        assertThat(results).containsExactly("released", "released it");
    }

    @Test
    void shouldNotRunMoreCallsThanPoolSize() {
        ExecutorBlockingCallOffloader pair = new ExecutorBlockingCallOffloader(2);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<AsyncWork<Integer>> calls = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            calls.add(pair.runBlocking(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(20);
                } finally {
                    running.decrementAndGet();
                }
                return 1;
            }));
        }

        try {
            List<Integer> results = new SingleThreadEventLoop().runUntilComplete(AsyncWork.all(calls));

            assertThat(results).hasSize(8);
            assertThat(maxRunning.get()).isEqualTo(2);
        } finally {
            pair.shutdown(1);
        }
    }

    @Test
    void shouldRunCallsInParallel() {
        CyclicBarrier bothArrived = new CyclicBarrier(2);
        AsyncWork<Integer> first = offloader.runBlocking(() -> bothArrived.await(5, TimeUnit.SECONDS));
        AsyncWork<Integer> second = offloader.runBlocking(() -> bothArrived.await(5, TimeUnit.SECONDS));

        List<Integer> arrivals = new SingleThreadEventLoop().runUntilComplete(AsyncWork.all(List.of(first, second)));

        assertThat(arrivals).containsExactlyInAnyOrder(0, 1);
    }

    @Test
    void shouldStartNewCallEachTimeWorkStarts() {
        AtomicInteger calls = new AtomicInteger();
        AsyncWork<Integer> counted = offloader.runBlocking(calls::incrementAndGet);

        new SingleThreadEventLoop().runUntilComplete(counted);
        new SingleThreadEventLoop().runUntilComplete(counted);

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void shouldRejectCallsAfterShutdown() {
        offloader.shutdown(1);

        assertThatThrownBy(() -> new SingleThreadEventLoop().runUntilComplete(offloader.runBlocking(() -> 1)))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void shouldRequirePositivePoolSize() {
        assertThatThrownBy(() -> new ExecutorBlockingCallOffloader(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("poolSize");
    }

    @Test
    void shouldDefaultPoolSizeToProcessorsPlusFourCappedAtThirtyTwo() {
        int expected = Math.min(32, Runtime.getRuntime().availableProcessors() + 4);

        assertThat(ExecutorBlockingCallOffloader.DEFAULT_POOL_SIZE).isEqualTo(expected);
    }
}

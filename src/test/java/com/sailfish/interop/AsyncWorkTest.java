package com.sailfish.interop;

import com.sailfish.interop.loop.SingleThreadEventLoop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class AsyncWorkTest {

    private static <T> T await(AsyncWork<T> work) {
        return new SingleThreadEventLoop().runUntilComplete(work);
    }

    @Test
    void shouldMapResult() {
        assertThat(AsyncWorkTest.<Integer>await(AsyncWork.completed(20).map(x -> x * 2 + 2))).isEqualTo(42);
    }

    @Test
    void shouldChainFurtherWork() {
        AsyncWork<String> chained = AsyncWork.completed("a")
                .flatMap(value -> AsyncWork.sleep(Duration.ofMillis(1)).map(v -> value + "b"));

        assertThat(await(chained)).isEqualTo("ab");
    }

    @Test
    void shouldNotRunMapperAfterFailure() {
        IllegalStateException boom = new IllegalStateException("boom");
        AsyncWork<Integer> failing = AsyncWork.<Integer>failed(boom).map(x -> x + 1);

        assertThatThrownBy(() -> await(failing)).isSameAs(boom);
    }

    @Test
    void shouldKeepOrderOfResultsRegardlessOfCompletionOrder() {
        List<AsyncWork<Integer>> works = List.of(
                AsyncWork.sleep(Duration.ofMillis(30)).map(v -> 1),
                AsyncWork.sleep(Duration.ofMillis(10)).map(v -> 2),
                AsyncWork.completed(3));

        assertThat(await(AsyncWork.all(works))).containsExactly(1, 2, 3);
    }

    @Test
    void shouldCompleteImmediatelyForNoWork() {
        List<AsyncWork<String>> none = Collections.emptyList();

        assertThat(await(AsyncWork.all(none))).isEmpty();
    }

    @Test
    void shouldFailAllWhenOneFails() {
        IllegalArgumentException bad = new IllegalArgumentException("bad");
        List<AsyncWork<Integer>> works = List.of(AsyncWork.completed(1), AsyncWork.failed(bad));

        assertThatThrownBy(() -> await(AsyncWork.all(works))).isSameAs(bad);
    }

    @Test
    void shouldSleepWithoutBlockingOtherWork() {
        long started = System.nanoTime();
        List<AsyncWork<Void>> sleeps = List.of(
                AsyncWork.sleep(Duration.ofMillis(100)),
                AsyncWork.sleep(Duration.ofMillis(100)),
                AsyncWork.sleep(Duration.ofMillis(100)));

        await(AsyncWork.all(sleeps));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(280));
    }
}

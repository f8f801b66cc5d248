package com.matey.anomaly.core.batch;

import com.matey.anomaly.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BatcherTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<List<Integer>> flushed = new CopyOnWriteArrayList<>();

    private Batcher<Integer> batcher(int maxSize, Duration interval) {
        return new Batcher<>("test", maxSize, interval, flushed::add, clock);
    }

    @Test
    void flushesAsSoonAsSizeIsReached() {
        Batcher<Integer> batcher = batcher(10, Duration.ofSeconds(5));

        IntStream.range(0, 10).forEach(batcher::submit);

        assertThat(flushed).hasSize(1);
        assertThat(flushed.get(0)).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(batcher.pendingCount()).isZero();
    }

    @Test
    void singleRecordFlushesOnceIntervalElapses() {
        Batcher<Integer> batcher = batcher(10, Duration.ofSeconds(5));

        batcher.submit(1);
        clock.advance(Duration.ofMillis(4999));
        batcher.flushIfDue();
        assertThat(flushed).isEmpty();

        clock.advance(Duration.ofMillis(1));
        batcher.flushIfDue();

        assertThat(flushed).containsExactly(List.of(1));
    }

    @Test
    void emptyBatcherNeverFlushesOnTime() {
        Batcher<Integer> batcher = batcher(10, Duration.ofSeconds(5));

        clock.advance(Duration.ofMinutes(1));
        batcher.flushIfDue();

        assertThat(flushed).isEmpty();
    }

    @Test
    void everyItemLandsInExactlyOneBatchInOrder() {
        Batcher<Integer> batcher = batcher(7, Duration.ofSeconds(5));

        for (int i = 0; i < 100; i++) {
            batcher.submit(i);
            if (i % 13 == 0) {
                clock.advance(Duration.ofSeconds(6));
                batcher.flushIfDue();
            }
        }
        batcher.close();

        List<Integer> all = flushed.stream().flatMap(List::stream).collect(Collectors.toList());
        assertThat(all).containsExactlyElementsOf(IntStream.range(0, 100).boxed().collect(Collectors.toList()));
        assertThat(flushed).allSatisfy(batch -> assertThat(batch).hasSizeLessThanOrEqualTo(7).isNotEmpty());
    }

    @Test
    void closeFlushesRemainderExactlyOnce() {
        Batcher<Integer> batcher = batcher(10, Duration.ofSeconds(5));
        batcher.submit(1);
        batcher.submit(2);

        batcher.close();
        batcher.close();

        assertThat(flushed).containsExactly(List.of(1, 2));
        assertThat(batcher.submit(3)).isFalse();
        assertThat(flushed).hasSize(1);
    }

    @Test
    void timerFlushesWithoutFurtherArrivals() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        Batcher<String> batcher = new Batcher<>("timer", 10, Duration.ofMillis(100), batch -> latch.countDown());
        batcher.start(Duration.ofMillis(10));

        batcher.submit("only");

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        batcher.close();
    }
}

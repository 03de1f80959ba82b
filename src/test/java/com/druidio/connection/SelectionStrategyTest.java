package com.druidio.connection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SelectionStrategy Tests")
class SelectionStrategyTest {

    @Test
    @DisplayName("should always pick the first broker with constant selection")
    void shouldAlwaysPickFirst() {
        // Given
        SelectionStrategy strategy = SelectionStrategy.constant();

        // When / Then
        for (int i = 0; i < 10; i++) {
            assertThat(strategy.select(3)).isZero();
        }
    }

    @Test
    @DisplayName("should cycle through brokers in order")
    void shouldCycleInOrder() {
        // Given
        SelectionStrategy strategy = SelectionStrategy.roundRobin();

        // When
        int[] picks = new int[7];
        for (int i = 0; i < picks.length; i++) {
            picks[i] = strategy.select(3);
        }

        // Then
        assertThat(picks).containsExactly(0, 1, 2, 0, 1, 2, 0);
    }

    @Test
    @DisplayName("should stay in range when the pool shrinks")
    void shouldStayInRangeWhenSizeShrinks() {
        // Given
        SelectionStrategy strategy = SelectionStrategy.roundRobin();
        strategy.select(5);
        strategy.select(5);
        strategy.select(5);

        // When
        int index = strategy.select(2);

        // Then
        assertThat(index).isZero();
        assertThat(strategy.select(2)).isEqualTo(1);
    }

    @Test
    @DisplayName("should default to constant for a single broker")
    void shouldDefaultByPoolSize() {
        assertThat(SelectionStrategy.defaultFor(List.of("b1:8082"))).isInstanceOf(SelectionStrategy.Constant.class);
        assertThat(SelectionStrategy.defaultFor(List.of("b1:8082", "b2:8082")))
            .isInstanceOf(SelectionStrategy.RoundRobin.class);
    }

    @Test
    @DisplayName("should hand out every index equally under concurrent access")
    void shouldBalanceUnderConcurrency() throws InterruptedException {
        // Given
        SelectionStrategy strategy = SelectionStrategy.roundRobin();
        int brokers = 4;
        int threadCount = 8;
        int callsPerThread = 1000;
        AtomicIntegerArray counts = new AtomicIntegerArray(brokers);
        AtomicInteger outOfRange = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);

        // When
        for (int t = 0; t < threadCount; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        int index = strategy.select(brokers);
                        if (index < 0 || index >= brokers) {
                            outOfRange.incrementAndGet();
                        } else {
                            counts.incrementAndGet(index);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        boolean finished = done.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertThat(finished).isTrue();
        assertThat(outOfRange.get()).isZero();
        int expected = threadCount * callsPerThread / brokers;
        for (int i = 0; i < brokers; i++) {
            assertThat(counts.get(i)).as("picks of broker %d", i).isEqualTo(expected);
        }
    }
}

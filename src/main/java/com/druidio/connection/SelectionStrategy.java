package com.druidio.connection;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Picks the index of the broker to use among {@code size} candidates.
 */
public interface SelectionStrategy {

    int select(int size);

    /**
     * Always the first broker.
     */
    static SelectionStrategy constant() {
        return new Constant();
    }

    /**
     * Cycles through the brokers in order, starting with the first one.
     */
    static SelectionStrategy roundRobin() {
        return new RoundRobin();
    }

    /**
     * {@link #constant()} for a single broker, {@link #roundRobin()} otherwise.
     */
    static SelectionStrategy defaultFor(List<String> brokers) {
        return brokers.size() == 1 ? constant() : roundRobin();
    }

    final class Constant implements SelectionStrategy {
        @Override
        public int select(int size) {
            return 0;
        }

        @Override
        public String toString() {
            return "constant";
        }
    }

    /**
     * Lock-free round robin. Concurrent callers never receive an index outside
     * {@code [0, size)}, and every index is handed out once per cycle of
     * {@code size} uncontended calls; under contention the order between
     * threads is not guaranteed.
     */
    final class RoundRobin implements SelectionStrategy {

        private final AtomicInteger next = new AtomicInteger();

        @Override
        public int select(int size) {
            while (true) {
                int current = next.get();
                int index = current >= size ? 0 : current;
                if (next.compareAndSet(current, index + 1)) {
                    return index;
                }
            }
        }

        @Override
        public String toString() {
            return "round-robin";
        }
    }
}

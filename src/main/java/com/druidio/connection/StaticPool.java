package com.druidio.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fixed list of brokers with a {@link SelectionStrategy} choosing between them.
 */
public class StaticPool implements BrokersPool {

    private static final Logger log = LoggerFactory.getLogger(StaticPool.class);

    private final List<String> brokers;
    private final SelectionStrategy strategy;

    /**
     * Uses {@link SelectionStrategy#defaultFor(List)}.
     */
    public StaticPool(List<String> brokers) {
        this(brokers, null);
    }

    /**
     * @throws IllegalArgumentException if {@code brokers} is null or empty
     */
    public StaticPool(List<String> brokers, SelectionStrategy strategy) {
        if (brokers == null || brokers.isEmpty()) {
            throw new IllegalArgumentException("At least one broker address is required");
        }
        this.brokers = List.copyOf(brokers);
        this.strategy = strategy == null ? SelectionStrategy.defaultFor(this.brokers) : strategy;
        log.debug("Broker pool of {} using {} selection", this.brokers, this.strategy);
    }

    @Override
    public String broker() {
        return brokers.get(strategy.select(brokers.size()));
    }

    public List<String> getBrokers() {
        return brokers;
    }

    public SelectionStrategy getStrategy() {
        return strategy;
    }
}

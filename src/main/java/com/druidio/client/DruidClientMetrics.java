package com.druidio.client;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics collector for queries sent to the brokers.
 * Tracks completed and failed queries, failures per {@link ErrorKind}, and round trip latency.
 */
public class DruidClientMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter queriesExecuted;
    private final Counter queriesFailed;
    private final Map<ErrorKind, Counter> errorsByKind = new EnumMap<>(ErrorKind.class);
    private final Timer queryLatency;

    /**
     * Registers with Micrometer's global registry.
     */
    public DruidClientMetrics() {
        this(Metrics.globalRegistry);
    }

    public DruidClientMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        queriesExecuted = Counter.builder("druid.client.query.executed")
            .description("Total number of queries answered by a broker")
            .register(meterRegistry);

        queriesFailed = Counter.builder("druid.client.query.failed")
            .description("Total number of queries that failed")
            .register(meterRegistry);

        for (ErrorKind kind : ErrorKind.values()) {
            errorsByKind.put(kind, Counter.builder("druid.client.query.errors")
                .description("Failed queries by error kind")
                .tag("kind", kind.name().toLowerCase())
                .register(meterRegistry));
        }

        queryLatency = Timer.builder("druid.client.query.latency")
            .description("Round trip latency of broker queries")
            .publishPercentiles(0.5, 0.95, 0.99) // P50, P95, P99
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(60))
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed(ErrorKind kind) {
        queriesFailed.increment();
        errorsByKind.get(kind == null ? ErrorKind.UNKNOWN : kind).increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryLatency);
    }

    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getErrors(ErrorKind kind) {
        return errorsByKind.get(kind);
    }

    public Timer getQueryLatency() {
        return queryLatency;
    }
}

package com.druidio.client;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DruidClientMetrics Tests")
class DruidClientMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private DruidClientMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new DruidClientMetrics(meterRegistry);
    }

    @Test
    @DisplayName("should register all meters on creation")
    void shouldRegisterMeters() {
        assertThat(meterRegistry.find("druid.client.query.executed").counter()).isNotNull();
        assertThat(meterRegistry.find("druid.client.query.failed").counter()).isNotNull();
        assertThat(meterRegistry.find("druid.client.query.latency").timer()).isNotNull();
        assertThat(meterRegistry.find("druid.client.query.errors").counters()).hasSize(ErrorKind.values().length);
    }

    @Test
    @DisplayName("should count executed queries")
    void shouldCountExecutedQueries() {
        // When
        metrics.recordQueryExecuted();
        metrics.recordQueryExecuted();

        // Then
        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("druid.client.query.executed").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should count failures per error kind with lowercase tags")
    void shouldCountFailuresPerKind() {
        // When
        metrics.recordQueryFailed(ErrorKind.SERVER);
        metrics.recordQueryFailed(ErrorKind.SERVER);
        metrics.recordQueryFailed(ErrorKind.RESPONSE_PARSING);

        // Then
        assertThat(metrics.getQueriesFailed().count()).isEqualTo(3.0);
        assertThat(meterRegistry.get("druid.client.query.errors").tag("kind", "server").counter().count())
            .isEqualTo(2.0);
        assertThat(meterRegistry.get("druid.client.query.errors").tag("kind", "response_parsing").counter().count())
            .isEqualTo(1.0);
        assertThat(metrics.getErrors(ErrorKind.TRANSPORT).count()).isZero();
    }

    @Test
    @DisplayName("should count failures without a kind as unknown")
    void shouldCountMissingKindAsUnknown() {
        // When
        metrics.recordQueryFailed(null);

        // Then
        assertThat(metrics.getErrors(ErrorKind.UNKNOWN).count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record query latency")
    void shouldRecordLatency() {
        // Given
        Timer.Sample sample = metrics.startQueryTimer();

        // When
        metrics.recordQueryLatency(sample);

        // Then
        assertThat(metrics.getQueryLatency().count()).isEqualTo(1L);
    }
}

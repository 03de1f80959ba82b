package com.druidio.client;

import com.druidio.connection.BrokersPool;
import com.druidio.connection.SelectionStrategy;
import com.druidio.connection.StaticPool;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DruidClientConfig Tests")
class DruidClientConfigTest {

    private AnnotationConfigApplicationContext context;

    @AfterEach
    void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    @Test
    @DisplayName("should default to a single local broker")
    void shouldDefaultToLocalBroker() {
        // When
        context = start(Map.of());

        // Then
        StaticPool pool = (StaticPool) context.getBean(BrokersPool.class);
        assertThat(pool.getBrokers()).containsExactly("localhost:8082");
        assertThat(pool.broker()).isEqualTo("localhost:8082");
        assertThat(context.getBean(DruidClient.class)).isNotNull();
    }

    @Test
    @DisplayName("should split and trim configured brokers")
    void shouldSplitBrokers() {
        // When
        context = start(Map.of("druid.client.brokers", "b1:8082, b2:8082 ,b3:8082"));

        // Then
        StaticPool pool = (StaticPool) context.getBean(BrokersPool.class);
        assertThat(pool.getBrokers()).containsExactly("b1:8082", "b2:8082", "b3:8082");
        assertThat(pool.getStrategy().toString()).isEqualTo("round-robin");
    }

    @Test
    @DisplayName("should apply the configured selection strategy")
    void shouldApplySelection() {
        // When
        context = start(Map.of("druid.client.brokers", "b1:8082,b2:8082", "druid.client.selection", "constant"));

        // Then
        BrokersPool pool = context.getBean(BrokersPool.class);
        assertThat(pool.broker()).isEqualTo("b1:8082");
        assertThat(pool.broker()).isEqualTo("b1:8082");
    }

    @Test
    @DisplayName("should fail startup on unknown selection strategy")
    void shouldRejectUnknownSelection() {
        assertThatThrownBy(() -> start(Map.of("druid.client.selection", "random")))
            .hasRootCauseInstanceOf(IllegalArgumentException.class)
            .hasRootCauseMessage("Unknown druid.client.selection value: random");
    }

    @Test
    @DisplayName("should publish metrics to the context's meter registry")
    void shouldUseContextMeterRegistry() {
        // When
        context = start(Map.of(), RegistryConfig.class);

        // Then
        MeterRegistry registry = context.getBean(MeterRegistry.class);
        context.getBean(DruidClientMetrics.class).recordQueryExecuted();
        assertThat(registry.get("druid.client.query.executed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should map selection names to strategies")
    void shouldMapSelectionNames() {
        assertThat(DruidClientConfig.strategyFor("auto")).isNull();
        assertThat(DruidClientConfig.strategyFor(null)).isNull();
        assertThat(DruidClientConfig.strategyFor(" Constant ").toString()).isEqualTo("constant");
        assertThat(DruidClientConfig.strategyFor("round-robin")).isInstanceOf(SelectionStrategy.class);
        assertThatThrownBy(() -> DruidClientConfig.strategyFor("sticky"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static AnnotationConfigApplicationContext start(Map<String, Object> properties, Class<?>... extra) {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        ctx.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
        ctx.register(DruidClientConfig.class);
        if (extra.length > 0) {
            ctx.register(extra);
        }
        try {
            ctx.refresh();
        } catch (RuntimeException e) {
            ctx.close();
            throw e;
        }
        return ctx;
    }

    @Configuration
    static class RegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}

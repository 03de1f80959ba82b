package com.druidio.client;

import com.druidio.connection.BrokersPool;
import com.druidio.connection.SelectionStrategy;
import com.druidio.connection.StaticPool;
import com.druidio.serialization.DruidJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration for the Druid client
 * Wires the broker pool, the JSON mapper and the reactive HTTP transport into a {@link DruidClient}
 */
@Configuration
public class DruidClientConfig {
    private static final Logger log = LoggerFactory.getLogger(DruidClientConfig.class);

    @Value("${druid.client.brokers:localhost:8082}")
    private String[] brokers;

    // auto | constant | round-robin
    @Value("${druid.client.selection:auto}")
    private String selection;

    @Value("${druid.client.response-timeout-ms:0}")
    private long responseTimeoutMs;

    // -1 = no limit
    @Value("${druid.client.max-response-bytes:-1}")
    private int maxResponseBytes;

    @Bean
    public ObjectMapper druidObjectMapper() {
        return DruidJson.newObjectMapper();
    }

    @Bean
    public BrokersPool brokersPool() {
        List<String> addresses = Arrays.stream(brokers)
            .map(String::trim)
            .filter(address -> !address.isEmpty())
            .collect(Collectors.toList());
        StaticPool pool = new StaticPool(addresses, strategyFor(selection));
        log.info("Druid broker pool initialized with brokers: {} ({})", pool.getBrokers(), pool.getStrategy());
        return pool;
    }

    /**
     * WebClient on reactor-netty; a positive {@code druid.client.response-timeout-ms}
     * bounds the wait for the broker's response, and {@code druid.client.max-response-bytes}
     * caps how much of a response body is buffered.
     */
    @Bean
    public WebClient druidWebClient() {
        HttpClient httpClient = HttpClient.create();
        if (responseTimeoutMs > 0) {
            httpClient = httpClient.responseTimeout(Duration.ofMillis(responseTimeoutMs));
        }
        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes))
            .build();
    }

    @Bean
    public DruidClientMetrics druidClientMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DruidClientMetrics(meterRegistry.getIfAvailable(() -> Metrics.globalRegistry));
    }

    @Bean
    public DruidClient druidClient(WebClient druidWebClient, BrokersPool brokersPool,
                                   ObjectMapper druidObjectMapper, DruidClientMetrics druidClientMetrics) {
        return new DruidClient(druidWebClient, brokersPool, druidObjectMapper, druidClientMetrics);
    }

    static SelectionStrategy strategyFor(String selection) {
        String value = selection == null ? "auto" : selection.trim().toLowerCase();
        return switch (value) {
            case "auto" -> null;
            case "constant" -> SelectionStrategy.constant();
            case "round-robin" -> SelectionStrategy.roundRobin();
            default -> throw new IllegalArgumentException("Unknown druid.client.selection value: " + selection);
        };
    }
}

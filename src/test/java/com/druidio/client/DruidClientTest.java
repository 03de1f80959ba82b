package com.druidio.client;

import com.druidio.connection.BrokersPool;
import com.druidio.connection.StaticPool;
import com.druidio.query.DataSource;
import com.druidio.query.DataSourceMetadata;
import com.druidio.query.GroupBy;
import com.druidio.query.Query;
import com.druidio.query.Scan;
import com.druidio.query.Search;
import com.druidio.query.SegmentMetadata;
import com.druidio.query.TimeBoundary;
import com.druidio.query.Timeseries;
import com.druidio.query.TopN;
import com.druidio.query.definitions.Aggregation;
import com.druidio.query.definitions.Dimension;
import com.druidio.query.definitions.Granularity;
import com.druidio.query.definitions.SearchQuerySpec;
import com.druidio.query.definitions.TimeBoundType;
import com.druidio.query.response.DimValue;
import com.druidio.serialization.DruidJson;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DruidClient Tests")
class DruidClientTest {

    private static final List<String> INTERVALS = List.of("2024-01-01/2024-01-02");
    private static final DataSource WIKIPEDIA = DataSource.table("wikipedia");

    @Mock
    private BrokersPool brokers;

    private SimpleMeterRegistry meterRegistry;
    private DruidClientMetrics metrics;
    private List<ClientRequest> requests;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new DruidClientMetrics(meterRegistry);
        requests = new ArrayList<>();
    }

    @Test
    @DisplayName("should post the query to the selected broker")
    void shouldPostToSelectedBroker() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        DruidClient client = clientAnswering(HttpStatus.OK, "[]");

        // When
        StepVerifier.create(client.timeBoundary(new TimeBoundary(WIKIPEDIA, TimeBoundType.MAX_TIME)))
            .assertNext(result -> assertThat(result).isEmpty())
            .verifyComplete();

        // Then
        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("http://b1:8082/druid/v2/?pretty");
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        verify(brokers, times(1)).broker();
    }

    @Test
    @DisplayName("should pick a broker per request")
    void shouldPickBrokerPerRequest() {
        // Given
        StaticPool pool = new StaticPool(List.of("b1:8082", "b2:8082"));
        DruidClient client = new DruidClient(stubWebClient(HttpStatus.OK, "[]"), pool,
            DruidJson.newObjectMapper(), metrics);
        DataSourceMetadata query = new DataSourceMetadata(WIKIPEDIA);

        // When
        client.dataSourceMetadata(query).block();
        client.dataSourceMetadata(query).block();
        client.dataSourceMetadata(query).block();

        // Then
        assertThat(requests).extracting(request -> request.url().getAuthority())
            .containsExactly("b1:8082", "b2:8082", "b1:8082");
    }

    @Test
    @DisplayName("should decode topN rows into the requested type")
    void shouldDecodeTopN() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        DruidClient client = clientAnswering(HttpStatus.OK,
            "[{\"timestamp\":\"2024-01-01T00:00:00.000Z\",\"result\":[{\"page\":\"Main\",\"edits\":12}]}]");
        TopN topN = new TopN(WIKIPEDIA, Dimension.of("page"), 10, "edits",
            List.of(Aggregation.count("edits")), INTERVALS, Granularity.ALL);

        // When / Then
        StepVerifier.create(client.topN(topN, PageEdits.class))
            .assertNext(result -> {
                assertThat(result).hasSize(1);
                assertThat(result.get(0).getResult().get(0).page).isEqualTo("Main");
                assertThat(result.get(0).getResult().get(0).edits).isEqualTo(12L);
            })
            .verifyComplete();
        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesFailed().count()).isZero();
        assertThat(metrics.getQueryLatency().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("should decode search and generic query results")
    void shouldDecodeSearchAndGenericQuery() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        DruidClient client = clientAnswering(HttpStatus.OK,
            "[{\"timestamp\":\"2024-01-01T00:00:00.000Z\",\"result\":[{\"dimension\":\"page\",\"value\":\"Main\",\"count\":2}]}]");
        Search search = new Search(WIKIPEDIA, null, null, null, INTERVALS, List.of("page"),
            SearchQuerySpec.insensitiveContains("ma"), null, null);

        // When / Then
        StepVerifier.create(client.search(search))
            .assertNext(result -> assertThat(result.get(0).getResult()).extracting(DimValue::getCount)
                .containsExactly(2L))
            .verifyComplete();
        StepVerifier.create(client.query(search, Map.class))
            .assertNext(result -> assertThat(result.get(0)).containsKey("result"))
            .verifyComplete();
    }

    @Test
    @DisplayName("should classify an error body as server error for every query kind")
    void shouldClassifyErrorBodyForEveryKind() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        String body = "{\"error\": \"some failure\"}";
        DruidClient client = clientAnswering(HttpStatus.OK, body);
        List<Function<DruidClient, Mono<?>>> calls = List.of(
            c -> c.topN(new TopN(WIKIPEDIA, Dimension.of("page"), 5, "edits", List.of(), INTERVALS, null), Map.class),
            c -> c.groupBy(GroupBy.builder(WIKIPEDIA).intervals(INTERVALS).build(), Map.class),
            c -> c.scan(new Scan(WIKIPEDIA, INTERVALS, null, null, null, null, 10L, null, null, null), Map.class),
            c -> c.search(new Search(WIKIPEDIA, null, null, null, INTERVALS, null,
                SearchQuerySpec.contains("x", false), null, null)),
            c -> c.timeBoundary(new TimeBoundary(WIKIPEDIA, null)),
            c -> c.segmentMetadata(new SegmentMetadata(WIKIPEDIA, INTERVALS, null, false, null, false)),
            c -> c.timeseries(new Timeseries(WIKIPEDIA, Granularity.DAY, false, INTERVALS, null, null, null, null,
                null), Map.class),
            c -> c.dataSourceMetadata(WIKIPEDIA),
            c -> c.query(new DataSourceMetadata(WIKIPEDIA), Map.class));

        // When / Then
        for (Function<DruidClient, Mono<?>> call : calls) {
            StepVerifier.create(call.apply(client))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DruidClientException.class);
                    DruidClientException e = (DruidClientException) error;
                    assertThat(e.getKind()).isEqualTo(ErrorKind.SERVER);
                    assertThat(e.getResponseBody()).isEqualTo(body);
                    assertThat(e.getMessage()).contains("some failure");
                })
                .verify();
        }
        assertThat(metrics.getErrors(ErrorKind.SERVER).count()).isEqualTo(calls.size());
        assertThat(metrics.getQueriesExecuted().count()).isZero();
    }

    @Test
    @DisplayName("should classify error body even when served with a failure status")
    void shouldClassifyErrorBodyOnFailureStatus() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        String body = "{\"error\":\"Query timeout\",\"errorClass\":\"QueryTimeoutException\",\"host\":null}";
        DruidClient client = clientAnswering(HttpStatus.GATEWAY_TIMEOUT, body);

        // When / Then
        StepVerifier.create(client.timeBoundary(new TimeBoundary(WIKIPEDIA, null)))
            .expectErrorSatisfies(error -> assertThat(((DruidClientException) error).getKind())
                .isEqualTo(ErrorKind.SERVER))
            .verify();
    }

    @Test
    @DisplayName("should report invalid JSON as response parsing error")
    void shouldReportInvalidJson() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        DruidClient client = clientAnswering(HttpStatus.OK, "<html>Bad gateway</html>");

        // When / Then
        StepVerifier.create(client.dataSourceMetadata(WIKIPEDIA))
            .expectErrorSatisfies(error -> {
                DruidClientException e = (DruidClientException) error;
                assertThat(e.getKind()).isEqualTo(ErrorKind.RESPONSE_PARSING);
                assertThat(e.getResponseBody()).isEqualTo("<html>Bad gateway</html>");
            })
            .verify();
        assertThat(metrics.getErrors(ErrorKind.RESPONSE_PARSING).count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should report shape mismatch as response parsing error")
    void shouldReportShapeMismatch() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        DruidClient client = clientAnswering(HttpStatus.OK, "{\"unexpected\":true}");

        // When / Then
        StepVerifier.create(client.segmentMetadata(new SegmentMetadata(WIKIPEDIA, INTERVALS, null, false, null, false)))
            .expectErrorSatisfies(error -> {
                DruidClientException e = (DruidClientException) error;
                assertThat(e.getKind()).isEqualTo(ErrorKind.RESPONSE_PARSING);
                assertThat(e.getCause()).isNotNull();
            })
            .verify();
    }

    @Test
    @DisplayName("should report an empty body as response parsing error")
    void shouldReportEmptyBody() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        DruidClient client = clientAnswering(HttpStatus.NO_CONTENT, "");

        // When / Then
        StepVerifier.create(client.dataSourceMetadata(WIKIPEDIA))
            .expectErrorSatisfies(error -> {
                DruidClientException e = (DruidClientException) error;
                assertThat(e.getKind()).isEqualTo(ErrorKind.RESPONSE_PARSING);
                assertThat(e.getMessage()).contains("empty response");
            })
            .verify();
    }

    @Test
    @DisplayName("should report a null body as response parsing error")
    void shouldReportNullBody() {
        // Given
        when(brokers.broker()).thenReturn("b1:8082");
        DruidClient client = clientAnswering(HttpStatus.OK, "null");

        // When / Then
        StepVerifier.create(client.query(new DataSourceMetadata(WIKIPEDIA), Map.class))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(DruidClientException.class);
                DruidClientException e = (DruidClientException) error;
                assertThat(e.getKind()).isEqualTo(ErrorKind.RESPONSE_PARSING);
                assertThat(e.getResponseBody()).isEqualTo("null");
            })
            .verify();
        assertThat(metrics.getErrors(ErrorKind.RESPONSE_PARSING).count()).isEqualTo(1.0);
        assertThat(metrics.getErrors(ErrorKind.UNKNOWN).count()).isZero();
    }

    @Test
    @DisplayName("should report connection failure as transport error")
    void shouldReportTransportFailure() {
        // Given
        when(brokers.broker()).thenReturn("down:8082");
        ExchangeFunction failing = request -> Mono.error(new ConnectException("Connection refused"));
        DruidClient client = new DruidClient(WebClient.builder().exchangeFunction(failing).build(), brokers,
            DruidJson.newObjectMapper(), metrics);

        // When / Then
        StepVerifier.create(client.timeBoundary(new TimeBoundary(WIKIPEDIA, null)))
            .expectErrorSatisfies(error -> {
                DruidClientException e = (DruidClientException) error;
                assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSPORT);
                assertThat(e).hasRootCauseInstanceOf(IOException.class);
                assertThat(e.getResponseBody()).isNull();
            })
            .verify();
        assertThat(metrics.getErrors(ErrorKind.TRANSPORT).count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesFailed().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should report a query that cannot be written as serialization error")
    void shouldReportSerializationFailure() {
        // Given
        DruidClient client = clientAnswering(HttpStatus.OK, "[]");
        Query broken = new UnwritableQuery();

        // When / Then
        StepVerifier.create(client.query(broken, Map.class))
            .expectErrorSatisfies(error -> assertThat(((DruidClientException) error).getKind())
                .isEqualTo(ErrorKind.SERIALIZATION))
            .verify();
        assertThat(requests).isEmpty();
        verify(brokers, never()).broker();
    }

    @Test
    @DisplayName("should not send anything until subscribed")
    void shouldBeLazy() {
        // Given
        DruidClient client = clientAnswering(HttpStatus.OK, "[]");

        // When
        client.timeBoundary(new TimeBoundary(WIKIPEDIA, null));

        // Then
        assertThat(requests).isEmpty();
        verifyNoInteractions(brokers);
    }

    private DruidClient clientAnswering(HttpStatus status, String body) {
        return new DruidClient(stubWebClient(status, body), brokers, DruidJson.newObjectMapper(), metrics);
    }

    private WebClient stubWebClient(HttpStatus status, String body) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
        };
        return WebClient.builder().exchangeFunction(exchange).build();
    }

    static class PageEdits {
        public String page;
        public long edits;
    }

    static class UnwritableQuery implements Query {
        @Override
        public DataSource getDataSource() {
            throw new IllegalStateException("no data source");
        }
    }
}

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
import com.druidio.query.response.DimValue;
import com.druidio.query.response.DruidListResponse;
import com.druidio.query.response.GroupByResponse;
import com.druidio.query.response.MetadataResponse;
import com.druidio.query.response.ScanResponse;
import com.druidio.query.response.SegmentMetadataResponse;
import com.druidio.query.response.TimeBoundaryResponse;
import com.druidio.serialization.DruidJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Sends native queries to a broker and decodes the answers.
 *
 * Every call is one HTTP POST to a broker picked from the {@link BrokersPool}; there
 * are no retries and no caching. Failures are signalled as {@link DruidClientException}
 * carrying an {@link ErrorKind} and are left to the caller to report.
 */
public class DruidClient {

    private static final Logger log = LoggerFactory.getLogger(DruidClient.class);

    static final String QUERY_PATH = "/druid/v2/?pretty";

    // -1 removes WebFlux's 256 KiB buffering limit; responses are decoded whole
    static final int UNLIMITED_RESPONSE_BYTES = -1;

    private final WebClient webClient;
    private final BrokersPool brokers;
    private final ObjectMapper mapper;
    private final DruidClientMetrics metrics;

    /**
     * Client over the given {@code host:port} brokers with default transport and JSON settings.
     */
    public DruidClient(List<String> brokers) {
        this(WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(UNLIMITED_RESPONSE_BYTES))
                .build(),
            new StaticPool(brokers), DruidJson.newObjectMapper(), new DruidClientMetrics());
    }

    public DruidClient(WebClient webClient, BrokersPool brokers, ObjectMapper mapper, DruidClientMetrics metrics) {
        this.webClient = webClient;
        this.brokers = brokers;
        this.mapper = mapper;
        this.metrics = metrics;
    }

    /**
     * Runs any query and decodes each element of the response array as {@code rowType}.
     */
    public <T> Mono<List<T>> query(Query query, Class<T> rowType) {
        return execute(query, types().constructCollectionType(List.class, rowType));
    }

    public <T> Mono<List<DruidListResponse<T>>> topN(TopN query, Class<T> rowType) {
        return execute(query, listOf(DruidListResponse.class, rowType));
    }

    public <T> Mono<List<GroupByResponse<T>>> groupBy(GroupBy query, Class<T> rowType) {
        return execute(query, listOf(GroupByResponse.class, rowType));
    }

    public <T> Mono<List<ScanResponse<T>>> scan(Scan query, Class<T> rowType) {
        return execute(query, listOf(ScanResponse.class, rowType));
    }

    public Mono<List<DruidListResponse<DimValue>>> search(Search query) {
        return execute(query, listOf(DruidListResponse.class, DimValue.class));
    }

    public Mono<List<TimeBoundaryResponse>> timeBoundary(TimeBoundary query) {
        return execute(query, types().constructCollectionType(List.class, TimeBoundaryResponse.class));
    }

    public Mono<List<SegmentMetadataResponse>> segmentMetadata(SegmentMetadata query) {
        return execute(query, types().constructCollectionType(List.class, SegmentMetadataResponse.class));
    }

    public <T> Mono<List<MetadataResponse<T>>> timeseries(Timeseries query, Class<T> rowType) {
        return execute(query, listOf(MetadataResponse.class, rowType));
    }

    public Mono<List<MetadataResponse<Map<String, String>>>> dataSourceMetadata(DataSourceMetadata query) {
        JavaType result = types().constructMapType(Map.class, String.class, String.class);
        return execute(query, listOf(MetadataResponse.class, result));
    }

    public Mono<List<MetadataResponse<Map<String, String>>>> dataSourceMetadata(DataSource dataSource) {
        return dataSourceMetadata(new DataSourceMetadata(dataSource));
    }

    /**
     * Sends {@code query} and decodes the response as {@code responseType}.
     */
    public <R> Mono<R> execute(Query query, JavaType responseType) {
        return Mono.defer(() -> {
            Timer.Sample sample = metrics.startQueryTimer();
            String queryType = query.getClass().getSimpleName();
            return Mono.fromCallable(() -> serialize(query))
                .flatMap(body -> post(queryType, body))
                .<R>map(body -> decode(body, responseType))
                .doOnSuccess(result -> metrics.recordQueryExecuted())
                .doOnError(e -> metrics.recordQueryFailed(kindOf(e)))
                .doFinally(signal -> metrics.recordQueryLatency(sample));
        });
    }

    private String serialize(Query query) {
        try {
            return mapper.writeValueAsString(query);
        } catch (JsonProcessingException e) {
            throw new DruidClientException(ErrorKind.SERIALIZATION,
                "Could not write " + query.getClass().getSimpleName() + " query as JSON", e);
        }
    }

    private Mono<String> post(String queryType, String body) {
        return Mono.defer(() -> {
            String broker = brokers.broker();
            log.debug("Sending {} query to broker {}", queryType, broker);
            return webClient.post()
                .uri(URI.create("http://" + broker + QUERY_PATH))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> response.bodyToMono(String.class).defaultIfEmpty(""))
                .doOnNext(response -> log.debug("Broker {} answered {} query with {} chars",
                    broker, queryType, response.length()));
        }).onErrorMap(e -> !(e instanceof DruidClientException),
            e -> new DruidClientException(ErrorKind.TRANSPORT, "Request to broker failed: " + e.getMessage(), e));
    }

    private <R> R decode(String body, JavaType responseType) {
        JsonNode tree;
        try {
            tree = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DruidClientException(ErrorKind.RESPONSE_PARSING, "Broker response is not valid JSON", body, e);
        }
        if (tree == null || tree.isMissingNode()) {
            throw new DruidClientException(ErrorKind.RESPONSE_PARSING, "Broker returned an empty response", body, null);
        }
        if (tree.isNull()) {
            throw new DruidClientException(ErrorKind.RESPONSE_PARSING, "Broker returned a null response", body, null);
        }
        if (tree.isObject() && tree.has("error")) {
            throw new DruidClientException(ErrorKind.SERVER,
                "Broker reported an error: " + tree.get("error").asText(), body, null);
        }
        R result;
        try {
            result = mapper.readerFor(responseType).readValue(tree);
        } catch (IOException e) {
            throw new DruidClientException(ErrorKind.RESPONSE_PARSING,
                "Broker response does not match " + responseType.toCanonical(), body, e);
        }
        if (result == null) {
            throw new DruidClientException(ErrorKind.RESPONSE_PARSING,
                "Broker response decoded to nothing for " + responseType.toCanonical(), body, null);
        }
        return result;
    }

    private static ErrorKind kindOf(Throwable error) {
        return error instanceof DruidClientException ? ((DruidClientException) error).getKind() : ErrorKind.UNKNOWN;
    }

    private TypeFactory types() {
        return mapper.getTypeFactory();
    }

    private JavaType listOf(Class<?> envelope, Class<?> rowType) {
        return listOf(envelope, types().constructType(rowType));
    }

    private JavaType listOf(Class<?> envelope, JavaType rowType) {
        return types().constructCollectionType(List.class, types().constructParametricType(envelope, rowType));
    }
}

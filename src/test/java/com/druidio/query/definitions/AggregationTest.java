package com.druidio.query.definitions;

import com.druidio.serialization.DruidJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Aggregation Tests")
class AggregationTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = DruidJson.newObjectMapper();
    }

    @Test
    @DisplayName("should round trip every aggregation kind")
    void shouldRoundTripAllAggregations() throws Exception {
        // Given
        List<Aggregation> aggregations = List.of(
            Aggregation.count("rows"),
            Aggregation.longSum("a", "f"), Aggregation.doubleSum("b", "f"), Aggregation.floatSum("c", "f"),
            Aggregation.longMax("d", "f"), Aggregation.doubleMax("e", "f"), Aggregation.floatMax("g", "f"),
            Aggregation.longMin("h", "f"), Aggregation.doubleMin("i", "f"), Aggregation.floatMin("j", "f"),
            Aggregation.longFirst("k", "f"), Aggregation.doubleFirst("l", "f"), Aggregation.floatFirst("m", "f"),
            Aggregation.longLast("n", "f"), Aggregation.doubleLast("o", "f"), Aggregation.floatLast("p", "f"),
            Aggregation.doubleAny("q", "f"), Aggregation.floatAny("r", "f"), Aggregation.longAny("s", "f"),
            Aggregation.stringAny("t", "f"),
            Aggregation.stringFirst("u", "f", 1024), Aggregation.stringLast("v", "f", null),
            new Aggregation.Javascript("w", List.of("x", "y"), "function(c, x, y) { return c + x + y; }",
                "function(a, b) { return a + b; }", "function() { return 0; }"),
            new Aggregation.ThetaSketch("theta", "user", false, 16384),
            new Aggregation.HllSketchBuild("hll", "user", 12, HllType.HLL_4, true),
            new Aggregation.Cardinality("card", List.of("country", "city"), true, false),
            new Aggregation.HyperUnique("uniq", "user_hll", true, true),
            Aggregation.filtered(Filter.selector("device", "mobile"), Aggregation.longSum("mobile_added", "added")));

        // When
        TypeReference<List<Aggregation>> listType = new TypeReference<>() { };
        String json = mapper.writerFor(listType).writeValueAsString(aggregations);
        List<Aggregation> decoded = mapper.readValue(json, listType);

        // Then
        assertThat(decoded).containsExactlyElementsOf(aggregations);
    }

    @Test
    @DisplayName("should keep same-shaped aggregations of different kinds apart")
    void shouldDistinguishSameShapedKinds() {
        assertThat(Aggregation.longSum("a", "f")).isNotEqualTo(Aggregation.doubleSum("a", "f"));
        assertThat(Aggregation.longSum("a", "f")).isEqualTo(Aggregation.longSum("a", "f"));
    }

    @Test
    @DisplayName("should name filtered aggregation after its aggregator")
    void shouldNameFilteredAfterAggregator() throws Exception {
        // Given
        Aggregation filtered = Aggregation.filtered(Filter.selector("device", "mobile"), Aggregation.count("mobile"));

        // When
        JsonNode json = mapper.valueToTree(filtered);
        Aggregation decoded = mapper.readValue(
            "{\"type\":\"filtered\",\"filter\":{\"type\":\"true\"},\"aggregator\":{\"type\":\"count\",\"name\":\"all\"}}",
            Aggregation.class);

        // Then
        assertThat(filtered.getName()).isEqualTo("mobile");
        assertThat(json.get("name").asText()).isEqualTo("mobile");
        assertThat(json.get("aggregator").get("type").asText()).isEqualTo("count");
        assertThat(decoded.getName()).isEqualTo("all");
    }

    @Test
    @DisplayName("should use broker tags for sketch aggregations")
    void shouldUseBrokerTagsForSketches() {
        // When
        JsonNode hll = mapper.valueToTree(new Aggregation.HllSketchBuild("hll", "user", null, null, false));
        JsonNode theta = mapper.valueToTree(new Aggregation.ThetaSketch("theta", "user", true, null));
        JsonNode unique = mapper.valueToTree(new Aggregation.HyperUnique("uniq", "user", true, false));

        // Then
        assertThat(hll.get("type").asText()).isEqualTo("HLLSketchBuild");
        assertThat(hll.has("lgK")).isFalse();
        assertThat(theta.get("type").asText()).isEqualTo("thetaSketch");
        assertThat(theta.get("isInputThetaSketch").asBoolean()).isTrue();
        assertThat(unique.get("isInputHyperUnique").asBoolean()).isTrue();
    }
}

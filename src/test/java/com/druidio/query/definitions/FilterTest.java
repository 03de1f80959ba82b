package com.druidio.query.definitions;

import com.druidio.serialization.DruidJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Filter Tests")
class FilterTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = DruidJson.newObjectMapper();
    }

    @Test
    @DisplayName("should round trip every filter kind inside a boolean tree")
    void shouldRoundTripFilterTree() throws Exception {
        // Given
        Filter tree = Filter.or(
            Filter.and(
                new Filter.Selector("country", "FR", new ExtractionFn.Upper("fr")),
                Filter.columnComparison(List.of("a", "b")),
                Filter.regex("page", "^Main"),
                Filter.javascript("added", "function(x) { return x > 10; }")),
            Filter.not(Filter.in("user", List.of("bot-1", "bot-2"))),
            new Filter.Search("page", SearchQuerySpec.regex("wiki.*")),
            new Filter.Like("page", "Main\\_%", "\\", null),
            new Filter.Bound("added", "10", "100", true, false, SortingOrder.NUMERIC, null),
            new Filter.Interval("__time", List.of("2024-01-01/2024-01-02"), new ExtractionFn.Bucket(10, 0)),
            Filter.alwaysTrue());

        // When
        String json = mapper.writeValueAsString(tree);
        Filter decoded = mapper.readValue(json, Filter.class);

        // Then
        assertThat(decoded).isEqualTo(tree);
    }

    @Test
    @DisplayName("should write selector with null value")
    void shouldWriteSelectorForMissingValue() {
        // When
        JsonNode json = mapper.valueToTree(Filter.selector("country", null));

        // Then
        assertThat(json.get("type").asText()).isEqualTo("selector");
        assertThat(json.has("value")).isFalse();
    }

    @Test
    @DisplayName("should default bound ordering to lexicographic")
    void shouldDefaultBoundOrdering() throws Exception {
        // When
        Filter bound = mapper.readValue("{\"type\":\"bound\",\"dimension\":\"name\",\"lower\":\"a\"}", Filter.class);

        // Then
        assertThat(bound).isInstanceOf(Filter.Bound.class);
        assertThat(mapper.valueToTree(bound).get("ordering").asText()).isEqualTo("lexicographic");
        assertThat(mapper.valueToTree(bound).get("lowerStrict").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("should accept tagged bound ordering")
    void shouldAcceptTaggedBoundOrdering() throws Exception {
        // When
        Filter tagged = mapper.readValue(
            "{\"type\":\"bound\",\"dimension\":\"n\",\"upper\":\"9\",\"ordering\":{\"type\":\"numeric\"}}", Filter.class);
        Filter bare = mapper.readValue(
            "{\"type\":\"bound\",\"dimension\":\"n\",\"upper\":\"9\",\"ordering\":\"numeric\"}", Filter.class);

        // Then
        assertThat(tagged).isEqualTo(bare);
    }

    @Test
    @DisplayName("should write search filter query spec with its tag")
    void shouldWriteSearchQuerySpecTag() {
        // When
        JsonNode json = mapper.valueToTree(new Filter.Search("page", SearchQuerySpec.insensitiveContains("wiki")));

        // Then
        assertThat(json.get("query").get("type").asText()).isEqualTo("insensitive_contains");
        assertThat(json.get("query").get("value").asText()).isEqualTo("wiki");
    }

    @Test
    @DisplayName("should write always true filter as bare tag")
    void shouldWriteTrueFilter() throws Exception {
        assertThat(mapper.writeValueAsString(Filter.alwaysTrue())).isEqualTo("{\"type\":\"true\"}");
        assertThat(mapper.readValue("{\"type\":\"true\"}", Filter.class)).isEqualTo(Filter.alwaysTrue());
    }
}

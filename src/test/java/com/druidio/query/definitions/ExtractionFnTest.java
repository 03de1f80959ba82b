package com.druidio.query.definitions;

import com.druidio.serialization.DruidJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExtractionFn Tests")
class ExtractionFnTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = DruidJson.newObjectMapper();
    }

    @Test
    @DisplayName("should round trip a cascade of every extraction kind")
    void shouldRoundTripCascade() throws Exception {
        // Given
        ExtractionFn cascade = new ExtractionFn.Cascade(List.of(
            new ExtractionFn.Regex("(\\w+)", 1, false, null),
            new ExtractionFn.Partial("^a"),
            new ExtractionFn.Substring(2, null),
            new ExtractionFn.Strlen(),
            new ExtractionFn.TimeFormat("yyyy-MM-dd", "Europe/Paris", "fr", Granularity.DAY, false),
            new ExtractionFn.Time("dd/MM/yyyy", "yyyy-MM-dd", true),
            new ExtractionFn.Javascript("function(x) { return x.toUpperCase(); }"),
            new ExtractionFn.RegisteredLookup("countries", true),
            new ExtractionFn.Lookup(new MapLookup(Map.of("a", "A"), true), false, true, "?"),
            new ExtractionFn.StringFormat("[%s]", NullHandling.RETURN_NULL),
            new ExtractionFn.Upper(null),
            new ExtractionFn.Lower("en"),
            new ExtractionFn.Bucket(5, 2)));

        // When
        ExtractionFn decoded = mapper.readValue(mapper.writeValueAsString(cascade), ExtractionFn.class);

        // Then
        assertThat(decoded).isEqualTo(cascade);
    }

    @Test
    @DisplayName("should leave time format granularity unset when absent")
    void shouldLeaveTimeFormatGranularityUnset() throws Exception {
        // When
        ExtractionFn fn = mapper.readValue("{\"type\":\"timeFormat\",\"format\":\"HH\"}", ExtractionFn.class);

        // Then
        assertThat(fn).isInstanceOf(ExtractionFn.TimeFormat.class);
        assertThat(((ExtractionFn.TimeFormat) fn).getGranularity()).isNull();
        assertThat(mapper.valueToTree(fn).has("granularity")).isFalse();
    }

    @Test
    @DisplayName("should write map lookup with its map tag and isOneToOne flag")
    void shouldWriteMapLookup() {
        // When
        JsonNode json = mapper.valueToTree(
            new ExtractionFn.Lookup(new MapLookup(Map.of("k", "v"), false), true, false, null));

        // Then
        assertThat(json.get("type").asText()).isEqualTo("lookup");
        assertThat(json.get("lookup").get("type").asText()).isEqualTo("map");
        assertThat(json.get("lookup").get("isOneToOne").asBoolean()).isFalse();
        assertThat(json.get("lookup").get("map").get("k").asText()).isEqualTo("v");
        assertThat(json.has("replaceMissingValueWith")).isFalse();
    }

    @Test
    @DisplayName("should decode map lookup without type tag")
    void shouldDecodeUntaggedMapLookup() throws Exception {
        // When
        ExtractionFn fn = mapper.readValue(
            "{\"type\":\"lookup\",\"lookup\":{\"map\":{\"k\":\"v\"}},\"retainMissingValue\":true}", ExtractionFn.class);

        // Then
        assertThat(fn).isEqualTo(new ExtractionFn.Lookup(new MapLookup(Map.of("k", "v"), false), true, false, null));
    }

    @Test
    @DisplayName("should write string format null handling in camel case")
    void shouldWriteNullHandling() {
        // When
        JsonNode json = mapper.valueToTree(new ExtractionFn.StringFormat("%s!", NullHandling.EMPTY_STRING));

        // Then
        assertThat(json.get("type").asText()).isEqualTo("stringFormat");
        assertThat(json.get("nullHandling").asText()).isEqualTo("emptyString");
    }
}

package com.druidio.serialization;

import com.druidio.query.DataSource;
import com.druidio.query.Timeseries;
import com.druidio.query.definitions.Filter;
import com.druidio.query.definitions.Granularity;
import com.druidio.query.definitions.SortingOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DruidJson Tests")
class DruidJsonTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = DruidJson.newObjectMapper();
    }

    @Test
    @DisplayName("should omit null properties on write")
    void shouldOmitNullProperties() throws Exception {
        // Given
        Filter selector = Filter.selector("page", "Main");

        // When
        JsonNode json = mapper.valueToTree(selector);

        // Then
        assertThat(json.has("extractionFn")).isFalse();
        assertThat(json.get("type").asText()).isEqualTo("selector");
        assertThat(json.get("value").asText()).isEqualTo("Main");
    }

    @Test
    @DisplayName("should decode null list as empty list")
    void shouldDecodeNullListAsEmpty() throws Exception {
        // When
        DataSource union = mapper.readValue("{\"type\":\"union\",\"dataSources\":null}", DataSource.class);

        // Then
        assertThat(union).isInstanceOf(DataSource.Union.class);
        assertThat(((DataSource.Union) union).getDataSources()).isEmpty();
    }

    @Test
    @DisplayName("should ignore unknown properties on read")
    void shouldIgnoreUnknownProperties() throws Exception {
        // When
        DataSource table = mapper.readValue("{\"type\":\"table\",\"name\":\"wikipedia\",\"extra\":1}", DataSource.class);

        // Then
        assertThat(table).isEqualTo(DataSource.table("wikipedia"));
    }

    @Test
    @DisplayName("should decode granularity from bare and tagged forms")
    void shouldDecodeGranularityFromBothForms() throws Exception {
        assertThat(mapper.readValue("\"day\"", Granularity.class)).isEqualTo(Granularity.DAY);
        assertThat(mapper.readValue("{\"type\":\"day\"}", Granularity.class)).isEqualTo(Granularity.DAY);
        assertThat(mapper.readValue("\"FIFTEEN_MINUTE\"", Granularity.class)).isEqualTo(Granularity.FIFTEEN_MINUTE);
    }

    @Test
    @DisplayName("should decode duration granularity and write it tagged")
    void shouldRoundTripDurationGranularity() throws Exception {
        // Given
        Granularity granularity = Granularity.duration(7_200_000L);

        // When
        String json = mapper.writeValueAsString(granularity);
        Granularity decoded = mapper.readValue(json, Granularity.class);

        // Then
        assertThat(json).isEqualTo("{\"type\":\"duration\",\"duration\":7200000}");
        assertThat(decoded).isEqualTo(granularity);
        assertThat(decoded.isDuration()).isTrue();
    }

    @Test
    @DisplayName("should write simple granularity as bare string")
    void shouldWriteSimpleGranularityBare() throws Exception {
        assertThat(mapper.writeValueAsString(Granularity.THIRTY_MINUTE)).isEqualTo("\"thirty_minute\"");
    }

    @Test
    @DisplayName("should let owners default null or absent granularity to all")
    void shouldDefaultGranularityInOwner() throws Exception {
        // When
        Timeseries explicitNull = mapper.readValue("{\"queryType\":\"timeseries\","
            + "\"dataSource\":{\"type\":\"table\",\"name\":\"w\"},\"granularity\":null}", Timeseries.class);
        Timeseries absent = mapper.readValue("{\"queryType\":\"timeseries\","
            + "\"dataSource\":{\"type\":\"table\",\"name\":\"w\"}}", Timeseries.class);

        // Then
        assertThat(explicitNull.getGranularity()).isEqualTo(Granularity.ALL);
        assertThat(absent.getGranularity()).isEqualTo(Granularity.ALL);
        assertThat(mapper.readValue("null", Granularity.class)).isNull();
    }

    @Test
    @DisplayName("should reject unknown granularity name")
    void shouldRejectUnknownGranularity() {
        assertThatThrownBy(() -> mapper.readValue("\"fortnight\"", Granularity.class))
            .isInstanceOf(MismatchedInputException.class)
            .hasMessageContaining("Unknown Granularity value: fortnight");
    }

    @Test
    @DisplayName("should reject object without type field")
    void shouldRejectObjectWithoutType() {
        assertThatThrownBy(() -> mapper.readValue("{\"duration\":1000}", Granularity.class))
            .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    @DisplayName("should reject non-positive duration")
    void shouldRejectNonPositiveDuration() {
        assertThatThrownBy(() -> Granularity.duration(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should decode sorting order from bare and tagged forms")
    void shouldDecodeSortingOrder() throws Exception {
        assertThat(mapper.readValue("\"numeric\"", SortingOrder.class)).isEqualTo(SortingOrder.NUMERIC);
        assertThat(mapper.readValue("{\"type\":\"strlen\"}", SortingOrder.class)).isEqualTo(SortingOrder.STRLEN);
        assertThat(mapper.readValue("null", SortingOrder.class)).isNull();
    }
}

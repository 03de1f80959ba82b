package com.druidio.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Jackson configuration shared by the query model and the response model.
 */
public final class DruidJson {

    private DruidJson() {
    }

    /**
     * Create an {@link ObjectMapper} configured for the broker's wire format:
     * <ul>
     *   <li>{@code null} properties are omitted on write</li>
     *   <li>unknown response properties are ignored on read</li>
     *   <li>JSON {@code null} given for a list or map decodes to an empty one</li>
     * </ul>
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        JsonSetter.Value nullAsEmpty = JsonSetter.Value.forValueNulls(Nulls.AS_EMPTY);
        mapper.configOverride(List.class).setSetterInfo(nullAsEmpty);
        mapper.configOverride(Collection.class).setSetterInfo(nullAsEmpty);
        mapper.configOverride(Map.class).setSetterInfo(nullAsEmpty);
        return mapper;
    }
}

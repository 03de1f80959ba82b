package com.druidio.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a scalar value in its tagged form, {@code {"type": <value>}}.
 * Counterpart of {@link TaggedOrUntaggedDeserializer} for properties the
 * broker only accepts as objects.
 */
public class TypeTagSerializer extends StdSerializer<Object> {

    public TypeTagSerializer() {
        super(Object.class);
    }

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(TaggedOrUntaggedDeserializer.TYPE_FIELD);
        provider.defaultSerializeValue(value, gen);
        gen.writeEndObject();
    }
}

package com.druidio.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Base deserializer for values the broker writes either as a bare string
 * ({@code "day"}) or as an object carrying a {@code type} field
 * ({@code {"type": "day"}}).
 *
 * Resolution order: bare string first, then object with {@code type}. JSON
 * {@code null} and an absent property both decode to {@code null}; the owning
 * type applies its default.
 *
 * @param <T> decoded type
 */
public abstract class TaggedOrUntaggedDeserializer<T> extends StdDeserializer<T> {

    public static final String TYPE_FIELD = "type";

    protected TaggedOrUntaggedDeserializer(Class<T> valueClass) {
        super(valueClass);
    }

    /**
     * Resolve a bare name, as found in the string form or in the {@code type} field.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    protected abstract T fromName(String name);

    /**
     * Resolve the object form. Subclasses override this when the object form
     * carries more than the {@code type} field.
     */
    protected T fromObject(String type, JsonNode node, DeserializationContext ctxt) throws IOException {
        return fromName(type);
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return resolve(p.getText(), ctxt);
        }
        if (token == JsonToken.START_OBJECT || token == JsonToken.FIELD_NAME) {
            JsonNode node = ctxt.readTree(p);
            JsonNode type = node.get(TYPE_FIELD);
            if (type == null || !type.isTextual()) {
                return ctxt.reportInputMismatch(this,
                    "Expected string or object with a `%s` field for %s", TYPE_FIELD, handledType().getSimpleName());
            }
            try {
                return fromObject(type.asText(), node, ctxt);
            } catch (IllegalArgumentException e) {
                return ctxt.reportInputMismatch(this, "%s", e.getMessage());
            }
        }
        @SuppressWarnings("unchecked")
        T unexpected = (T) ctxt.handleUnexpectedToken(handledType(), p);
        return unexpected;
    }

    private T resolve(String name, DeserializationContext ctxt) throws IOException {
        try {
            return fromName(name);
        } catch (IllegalArgumentException e) {
            return ctxt.reportInputMismatch(this, "%s", e.getMessage());
        }
    }
}
